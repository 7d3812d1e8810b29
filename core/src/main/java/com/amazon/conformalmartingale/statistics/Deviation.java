/*
 * Copyright 2020 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package com.amazon.conformalmartingale.statistics;

/**
 * A running population mean and standard deviation of everything that was
 * seen.
 */
public class Deviation {

    protected double sumSquared = 0;

    protected double sum = 0;

    protected int count = 0;

    /**
     * a deviation over a block of values
     *
     * @param values the values
     * @return the statistic of the values
     */
    public static Deviation of(double[] values) {
        Deviation deviation = new Deviation();
        for (double value : values) {
            deviation.update(value);
        }
        return deviation;
    }

    public void update(double score) {
        sum += score;
        sumSquared += score * score;
        ++count;
    }

    public double getMean() {
        return (count == 0) ? 0 : sum / count;
    }

    public double getDeviation() {
        if (count == 0) {
            return 0;
        }
        double temp = sum / count;
        double answer = sumSquared / count - temp * temp;
        return (answer > 0) ? Math.sqrt(answer) : 0;
    }

    public int getCount() {
        return count;
    }
}

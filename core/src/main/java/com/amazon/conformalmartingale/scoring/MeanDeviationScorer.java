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

package com.amazon.conformalmartingale.scoring;

import com.amazon.conformalmartingale.statistics.Deviation;

/**
 * |x - mean| / (std + epsilon) where mean and (population) standard deviation
 * are those of the reference.
 */
public class MeanDeviationScorer extends AbstractScorer {

    @Override
    public boolean isMultivariate() {
        return false;
    }

    @Override
    protected double computeScore(double[] current, double[][] reference) {
        Deviation deviation = new Deviation();
        for (double[] row : reference) {
            deviation.update(row[0]);
        }
        return Math.abs(current[0] - deviation.getMean()) / (deviation.getDeviation() + STABILITY_EPSILON);
    }
}

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

package com.amazon.conformalmartingale;

import java.util.Random;

public class TestUtils {

    public static final double EPSILON = 1e-9;

    /**
     * p-values drawn uniformly from (0, 1]
     */
    public static double[] uniformPValues(int length, Random random) {
        double[] answer = new double[length];
        for (int i = 0; i < length; i++) {
            answer[i] = 1.0 - random.nextDouble();
        }
        return answer;
    }

    public static double[] drop(double[] values, int count) {
        double[] answer = new double[values.length - count];
        System.arraycopy(values, count, answer, 0, answer.length);
        return answer;
    }
}

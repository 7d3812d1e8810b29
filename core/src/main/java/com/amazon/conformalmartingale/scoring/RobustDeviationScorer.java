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

import org.apache.commons.math3.stat.descriptive.rank.Median;

/**
 * |x - median| / (1.4826 * MAD + epsilon). The constant makes the median
 * absolute deviation a consistent estimate of the standard deviation for
 * normal data.
 */
public class RobustDeviationScorer extends AbstractScorer {

    public static final double NORMAL_CONSISTENCY_CONSTANT = 1.4826;

    @Override
    public boolean isMultivariate() {
        return false;
    }

    @Override
    protected double computeScore(double[] current, double[][] reference) {
        double[] values = new double[reference.length];
        for (int i = 0; i < reference.length; i++) {
            values[i] = reference[i][0];
        }
        Median median = new Median();
        double center = median.evaluate(values);
        for (int i = 0; i < values.length; i++) {
            values[i] = Math.abs(values[i] - center);
        }
        double mad = median.evaluate(values);
        return Math.abs(current[0] - center) / (NORMAL_CONSISTENCY_CONSTANT * mad + STABILITY_EPSILON);
    }
}

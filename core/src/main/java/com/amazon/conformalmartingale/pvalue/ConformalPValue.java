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

package com.amazon.conformalmartingale.pvalue;

import static com.amazon.conformalmartingale.CommonUtils.checkArgument;

import lombok.Getter;

/**
 * The two conformal p-values of one score. Both lie in [MIN_P_VALUE, 1].
 */
@Getter
public class ConformalPValue {

    public static final double MIN_P_VALUE = 1e-10;

    /**
     * fraction of the window with a score at least as large or close to it
     */
    private final double deterministic;

    /**
     * strictly larger scores plus a uniform share of the ties, as a fraction of
     * the window
     */
    private final double randomized;

    public ConformalPValue(double deterministic, double randomized) {
        this.deterministic = deterministic;
        this.randomized = randomized;
    }

    /**
     * ranks the last score of a window among all the scores of the window
     *
     * @param scores    buffer holding the window
     * @param start     first index of the window (inclusive)
     * @param end       last index of the window (exclusive); scores[end - 1] is
     *                  the score being ranked
     * @param uniform   the draw in [0, 1) used to break ties
     * @param tolerance closeness rule for ties
     * @return the p-values
     */
    public static ConformalPValue evaluate(double[] scores, int start, int end, double uniform,
            TieTolerance tolerance) {
        checkArgument(0 <= start && start < end && end <= scores.length, "incorrect window");
        int size = end - start;
        if (size == 1) {
            return new ConformalPValue(1.0, 1.0);
        }
        double current = scores[end - 1];
        int atLeast = 0;
        int greater = 0;
        int equal = 0;
        for (int i = start; i < end; i++) {
            double value = scores[i];
            // close scores count as ties in both p-values
            if (tolerance.isClose(value, current)) {
                ++atLeast;
                ++equal;
            } else if (value > current) {
                ++atLeast;
                ++greater;
            }
        }
        double deterministic = (double) atLeast / size;
        double randomized = (greater + uniform * equal) / size;
        return new ConformalPValue(clamp(deterministic), clamp(randomized));
    }

    static double clamp(double p) {
        return Math.max(MIN_P_VALUE, Math.min(1.0, p));
    }

    /**
     * @param randomizedPreferred which of the two p-values to return
     * @return the randomized p-value if requested, otherwise the deterministic one
     */
    public double get(boolean randomizedPreferred) {
        return randomizedPreferred ? randomized : deterministic;
    }
}

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
import static com.amazon.conformalmartingale.CommonUtils.checkNotNull;

import com.amazon.conformalmartingale.util.UniformSequence;

/**
 * Batch form of {@link ConformalPValueEngine}.
 */
public class ConformalPValues {

    private ConformalPValues() {
    }

    public static PValueSequence compute(double[] scores, long seed) {
        return compute(scores, 0, TieTolerance.DEFAULT, seed);
    }

    /**
     * computes the p-values of every score against the scores before it
     *
     * @param scores            the series of scores, all finite
     * @param calibrationWindow number of earlier scores in each window, 0 for all
     * @param tolerance         closeness rule for ties
     * @param seed              seed of the tie breaking draws
     * @return the p-values, same length as scores
     */
    public static PValueSequence compute(double[] scores, int calibrationWindow, TieTolerance tolerance,
            long seed) {
        checkNotNull(scores, "scores cannot be null");
        checkNotNull(tolerance, "tolerance cannot be null");
        checkArgument(calibrationWindow >= 0, "calibration window cannot be negative");
        for (double score : scores) {
            checkArgument(Double.isFinite(score), "scores have to be finite");
        }
        UniformSequence uniforms = new UniformSequence(seed);
        double[] deterministic = new double[scores.length];
        double[] randomized = new double[scores.length];
        for (int n = 0; n < scores.length; n++) {
            int start = (calibrationWindow > 0) ? Math.max(0, n - calibrationWindow) : 0;
            ConformalPValue p = ConformalPValue.evaluate(scores, start, n + 1, uniforms.get(n), tolerance);
            deterministic[n] = p.getDeterministic();
            randomized[n] = p.getRandomized();
        }
        return new PValueSequence(deterministic, randomized);
    }
}

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

package com.amazon.conformalmartingale.testutils;

import java.util.Arrays;
import java.util.Random;

/**
 * This class samples points from a mixture of 2 multi-variate normal
 * distributions with covariance matrices of the form sigma * I. One of the
 * normal distributions is the base regime, the second is the shifted regime,
 * and the process switches between the two at random. Every switch is a change
 * point.
 */
public class NormalMixtureTestData {

    private final double baseMu;
    private final double baseSigma;
    private final double shiftedMu;
    private final double shiftedSigma;
    private final double transitionToShiftedProbability;
    private final double transitionToBaseProbability;

    public NormalMixtureTestData(double baseMu, double baseSigma, double shiftedMu, double shiftedSigma,
            double transitionToShiftedProbability, double transitionToBaseProbability) {
        this.baseMu = baseMu;
        this.baseSigma = baseSigma;
        this.shiftedMu = shiftedMu;
        this.shiftedSigma = shiftedSigma;
        this.transitionToShiftedProbability = transitionToShiftedProbability;
        this.transitionToBaseProbability = transitionToBaseProbability;
    }

    public NormalMixtureTestData() {
        this(0.0, 1.0, 4.0, 1.0, 0.005, 0.005);
    }

    public NormalMixtureTestData(double baseMu, double shiftedMu) {
        this(baseMu, 1.0, shiftedMu, 1.0, 0.005, 0.005);
    }

    public double[][] generateTestData(int numberOfRows, int numberOfColumns, long seed) {
        return generateTestDataWithKey(numberOfRows, numberOfColumns, seed).data;
    }

    public MultiDimDataWithKey generateTestDataWithKey(int numberOfRows, int numberOfColumns, long seed) {
        double[][] resultData = new double[numberOfRows][numberOfColumns];
        int[] change = new int[numberOfRows];
        int numberOfChanges = 0;
        boolean shifted = false;

        Random rng = new Random(seed);
        NormalDistribution dist = new NormalDistribution(new Random(rng.nextLong()));

        for (int i = 0; i < numberOfRows; i++) {
            if (!shifted) {
                fillRow(resultData[i], dist, baseMu, baseSigma);
                if (rng.nextDouble() < transitionToShiftedProbability && i + 1 < numberOfRows) {
                    change[numberOfChanges++] = i + 1; // next item is different
                    shifted = true;
                }
            } else {
                fillRow(resultData[i], dist, shiftedMu, shiftedSigma);
                if (rng.nextDouble() < transitionToBaseProbability && i + 1 < numberOfRows) {
                    change[numberOfChanges++] = i + 1;
                    shifted = false;
                }
            }
        }

        return new MultiDimDataWithKey(resultData, Arrays.copyOf(change, numberOfChanges), null);
    }

    private void fillRow(double[] row, NormalDistribution dist, double mu, double sigma) {
        for (int j = 0; j < row.length; j++) {
            row[j] = dist.nextDouble(mu, sigma);
        }
    }

    public static class NormalDistribution {
        private final Random rng;
        private final double[] buffer;
        private int index;

        public NormalDistribution(Random rng) {
            this.rng = rng;
            buffer = new double[2];
            index = 0;
        }

        public double nextDouble() {
            if (index == 0) {
                // apply the Box-Muller transform to produce Normal variates
                double u = 1.0 - rng.nextDouble();
                double v = rng.nextDouble();
                double r = Math.sqrt(-2 * Math.log(u));
                buffer[0] = r * Math.cos(2 * Math.PI * v);
                buffer[1] = r * Math.sin(2 * Math.PI * v);
            }

            double result = buffer[index];
            index = (index + 1) % 2;

            return result;
        }

        public double nextDouble(double mu, double sigma) {
            return mu + sigma * nextDouble();
        }
    }
}

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
 * Independent normal noise around a per column level, with a single change
 * point after which the level (and optionally the spread) of some columns
 * moves.
 */
public class LevelShiftTestData {

    private LevelShiftTestData() {
    }

    /**
     * @param before number of rows before the change
     * @param after  number of rows from the change on
     * @param shift  the mean shift of every column at the change
     * @param sigma  the noise level before the change
     * @param seed   random seed
     * @return the data and the change index
     */
    public static MultiDimDataWithKey generate(int before, int after, double[] shift, double sigma, long seed) {
        double[] scale = new double[shift.length];
        Arrays.fill(scale, 1.0);
        return generate(before, after, shift, scale, sigma, seed);
    }

    /**
     * as above, where column j has noise level scale[j] * sigma after the change
     */
    public static MultiDimDataWithKey generate(int before, int after, double[] shift, double[] scale, double sigma,
            long seed) {
        int columns = shift.length;
        NormalMixtureTestData.NormalDistribution dist = new NormalMixtureTestData.NormalDistribution(
                new Random(seed));
        double[][] data = new double[before + after][columns];
        for (int i = 0; i < before + after; i++) {
            for (int j = 0; j < columns; j++) {
                data[i][j] = (i < before) ? dist.nextDouble(0, sigma)
                        : dist.nextDouble(shift[j], sigma * scale[j]);
            }
        }
        return new MultiDimDataWithKey(data, new int[] { before }, new double[][] { shift.clone() });
    }

    /**
     * a univariate series that moves from mean 0 to mean shift at index before
     */
    public static double[] univariate(int before, int after, double shift, double sigma, long seed) {
        return generate(before, after, new double[] { shift }, sigma, seed).getColumn(0);
    }
}

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

/**
 * Synthetic data together with the indices at which its distribution changes.
 */
public class MultiDimDataWithKey {

    /**
     * rows are time, columns are features
     */
    public final double[][] data;

    /**
     * the first index of every new regime, ascending
     */
    public final int[] changeIndices;

    /**
     * the shift in the mean of every column at each change, may be null
     */
    public final double[][] changes;

    public MultiDimDataWithKey(double[][] data, int[] changeIndices, double[][] changes) {
        this.data = data;
        this.changeIndices = changeIndices;
        this.changes = changes;
    }

    /**
     * @param column a column index
     * @return a copy of the column
     */
    public double[] getColumn(int column) {
        double[] answer = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            answer[i] = data[i][column];
        }
        return answer;
    }
}

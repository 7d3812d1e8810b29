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

import java.util.Objects;

/** A collection of common utility functions. */
public class CommonUtils {

    private CommonUtils() {
    }

    /**
     * Throws an {@link IllegalArgumentException} with the specified message if the
     * specified input is false.
     *
     * @param condition A condition to test.
     * @param message   The error message to include in the
     *                  {@code IllegalArgumentException} if {@code condition} is
     *                  false.
     * @throws IllegalArgumentException if {@code condition} is false.
     */
    public static void checkArgument(boolean condition, String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }

    /**
     * Throws an {@link IllegalStateException} with the specified message if the
     * specified input is false.
     *
     * @param condition A condition to test.
     * @param message   The error message to include in the
     *                  {@code IllegalStateException} if {@code condition} is false.
     * @throws IllegalStateException if {@code condition} is false.
     */
    public static void checkState(boolean condition, String message) {
        if (!condition) {
            throw new IllegalStateException(message);
        }
    }

    /**
     * Throws a {@link NullPointerException} with the specified message if the
     * specified input is null.
     *
     * @param <T>     An arbitrary type.
     * @param object  An object reference to test for nullity.
     * @param message The error message to include in the
     *                {@code NullPointerException} if {@code object} is null.
     * @return {@code object} if not null.
     * @throws NullPointerException if the supplied object is null.
     */
    public static <T> T checkNotNull(T object, String message) {
        Objects.requireNonNull(object, message);
        return object;
    }

    /**
     * Verifies that a table of observations is rectangular, that is, every row has
     * the same number of columns. This check is performed before any processing so
     * that a ragged input never produces a partial result.
     *
     * @param data rows are time, columns are features
     * @return the common row length
     * @throws IllegalArgumentException if the table is empty or ragged
     */
    public static int checkShape(double[][] data) {
        checkNotNull(data, "data cannot be null");
        checkArgument(data.length > 0, "data cannot be empty");
        checkNotNull(data[0], "row 0 cannot be null");
        int dimensions = data[0].length;
        checkArgument(dimensions > 0, "rows must have at least one column");
        for (int i = 1; i < data.length; i++) {
            checkNotNull(data[i], "row " + i + " cannot be null");
            checkArgument(data[i].length == dimensions,
                    "row " + i + " has length " + data[i].length + ", expected " + dimensions);
        }
        return dimensions;
    }

    /**
     * Verifies that every value of an observation is finite.
     *
     * @param point the observation
     * @throws IllegalArgumentException if a value is NaN or infinite
     */
    public static void checkFinite(double[] point) {
        checkNotNull(point, "point cannot be null");
        for (double value : point) {
            checkArgument(Double.isFinite(value), "observations have to be finite");
        }
    }

    /**
     * clips a value into the closed interval [low, high]
     *
     * @param value the value
     * @param low   lower bound
     * @param high  upper bound
     * @return the clipped value
     */
    public static double clip(double value, double low, double high) {
        return Math.max(low, Math.min(high, value));
    }

    /**
     * converts a univariate series into a table with a single column
     *
     * @param series the series
     * @return a table of one column
     */
    public static double[][] toColumn(double[] series) {
        checkNotNull(series, "series cannot be null");
        double[][] answer = new double[series.length][];
        for (int i = 0; i < series.length; i++) {
            answer[i] = new double[] { series[i] };
        }
        return answer;
    }

    /**
     * extracts a single column of a rectangular table
     *
     * @param data   the table
     * @param column the column index
     * @return a copy of the column
     */
    public static double[] getColumn(double[][] data, int column) {
        checkNotNull(data, "data cannot be null");
        double[] answer = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            answer[i] = data[i][column];
        }
        return answer;
    }
}

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

package com.amazon.conformalmartingale.executor;

/**
 * Computes the nonconformity scores of a whole series in batch. With a sliding
 * reference index t is scored against the rows before it, optionally limited to
 * the last {@code referenceWindow} rows; with an inductive reference it is
 * scored against the first {@code referenceWindow} rows, which themselves
 * score 0. Executors are closed with try-with-resources once the scores are
 * computed.
 */
public interface IScoreExecutor extends AutoCloseable {

    /**
     * @param series rows are time, columns are features; must be rectangular
     * @return one score per row
     */
    double[] score(double[][] series);

    /**
     * @return the reference window, 0 when the full history is used
     */
    int getReferenceWindow();

    /**
     * releases the threads held by the executor, if any; the executor cannot
     * score after it is closed
     */
    @Override
    default void close() {
    }
}

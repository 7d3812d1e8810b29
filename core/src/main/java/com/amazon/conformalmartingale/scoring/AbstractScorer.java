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

import static com.amazon.conformalmartingale.CommonUtils.checkArgument;
import static com.amazon.conformalmartingale.CommonUtils.checkNotNull;

/**
 * Handles the warm-up and shape checks that are common to all scorers so that
 * subclasses only see a reference of at least
 * {@link INonconformityScorer#MINIMUM_REFERENCE_SIZE} rows of the right length.
 */
public abstract class AbstractScorer implements INonconformityScorer {

    @Override
    public double score(double[] current, double[][] reference) {
        checkNotNull(current, "current observation cannot be null");
        checkNotNull(reference, "reference cannot be null");
        checkArgument(current.length > 0, "observation cannot be empty");
        checkArgument(isMultivariate() || current.length == 1, "scorer only accepts univariate observations");
        if (reference.length < MINIMUM_REFERENCE_SIZE) {
            return 0;
        }
        for (double[] row : reference) {
            checkArgument(row != null && row.length == current.length, "reference rows must match the observation");
        }
        return Math.max(0, computeScore(current, reference));
    }

    /**
     * @return true if observations of more than one column are meaningful
     */
    public abstract boolean isMultivariate();

    /**
     * the actual scoring function
     *
     * @param current   the observation
     * @param reference at least two rows, all of the same length as current
     * @return the score
     */
    protected abstract double computeScore(double[] current, double[][] reference);
}

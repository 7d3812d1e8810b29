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

import static com.amazon.conformalmartingale.CommonUtils.checkNotNull;

/**
 * A nonconformity scorer measures how strange an observation is relative to a
 * reference set of earlier observations. Larger values are stranger. Scorers
 * are stateless and deterministic; the same inputs always produce the same
 * score.
 */
public interface INonconformityScorer {

    /**
     * the smallest reference for which a score carries evidence; below this size
     * the score is 0
     */
    int MINIMUM_REFERENCE_SIZE = 2;

    /**
     * additive guard used in denominators
     */
    double STABILITY_EPSILON = 1e-8;

    /**
     * scores an observation against the reference
     *
     * @param current   the new observation
     * @param reference earlier observations, each of the same length as current;
     *                  not modified
     * @return a non-negative finite score, 0 if the reference has fewer than
     *         {@link #MINIMUM_REFERENCE_SIZE} members
     */
    double score(double[] current, double[][] reference);

    /**
     * univariate convenience form
     *
     * @param current   the new value
     * @param reference earlier values
     * @return the score
     */
    default double score(double current, double[] reference) {
        checkNotNull(reference, "reference cannot be null");
        double[][] rows = new double[reference.length][];
        for (int i = 0; i < reference.length; i++) {
            rows[i] = new double[] { reference[i] };
        }
        return score(new double[] { current }, rows);
    }
}

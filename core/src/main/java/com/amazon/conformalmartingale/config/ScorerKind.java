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

package com.amazon.conformalmartingale.config;

import static com.amazon.conformalmartingale.CommonUtils.checkNotNull;

import com.amazon.conformalmartingale.scoring.DistanceScorer;
import com.amazon.conformalmartingale.scoring.INonconformityScorer;
import com.amazon.conformalmartingale.scoring.MahalanobisScorer;
import com.amazon.conformalmartingale.scoring.MeanDeviationScorer;
import com.amazon.conformalmartingale.scoring.RobustDeviationScorer;

public enum ScorerKind {

    /**
     * distance from the mean of the reference in units of its standard deviation
     */
    MEAN_DEVIATION("mean_dev", false),

    /**
     * same as MEAN_DEVIATION using the median and the scaled median absolute
     * deviation, which is not pulled along by a few outliers in the reference
     */
    ROBUST_MEAN_DEVIATION("robust_mean_dev", false),

    /**
     * smallest normalized Euclidean distance to a reference point; a measure of
     * local density
     */
    MIN_DISTANCE("min_dist", true),

    /**
     * average normalized Euclidean distance to the reference points
     */
    MEAN_DISTANCE("mean_dist", true),

    /**
     * distance from the reference mean accounting for the (regularized) covariance
     * of the reference
     */
    MAHALANOBIS("mahalanobis", true);

    private final String configName;

    private final boolean multivariate;

    ScorerKind(String configName, boolean multivariate) {
        this.configName = configName;
        this.multivariate = multivariate;
    }

    public String getConfigName() {
        return configName;
    }

    /**
     * @return true if the scorer accepts observations with more than one column
     */
    public boolean isMultivariate() {
        return multivariate;
    }

    /**
     * resolves a configuration name such as "robust_mean_dev"; the enum constant
     * name is accepted as well
     *
     * @param name the name
     * @return the scorer kind
     * @throws IllegalArgumentException for an unknown name
     */
    public static ScorerKind fromName(String name) {
        checkNotNull(name, "scorer kind cannot be null");
        for (ScorerKind kind : values()) {
            if (kind.configName.equalsIgnoreCase(name) || kind.name().equalsIgnoreCase(name)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("unknown scorer kind " + name);
    }

    /**
     * creates the scoring strategy; this is resolved once per configuration
     *
     * @param regularization the ridge term used by MAHALANOBIS
     * @return a scorer
     */
    public INonconformityScorer create(double regularization) {
        switch (this) {
        case MEAN_DEVIATION:
            return new MeanDeviationScorer();
        case ROBUST_MEAN_DEVIATION:
            return new RobustDeviationScorer();
        case MIN_DISTANCE:
            return new DistanceScorer(DistanceScorer.Aggregation.MIN);
        case MEAN_DISTANCE:
            return new DistanceScorer(DistanceScorer.Aggregation.MEAN);
        default:
            return new MahalanobisScorer(regularization);
        }
    }
}

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
 * Scores an observation by its normalized Euclidean distance ||x - x_i|| /
 * sqrt(d) to every member of the reference, aggregated by the minimum (local
 * density) or the mean. For univariate data this is the absolute difference.
 * The cost is linear in the size of the reference.
 */
public class DistanceScorer extends AbstractScorer {

    public enum Aggregation {
        MIN, MEAN
    }

    private final Aggregation aggregation;

    public DistanceScorer(Aggregation aggregation) {
        this.aggregation = checkNotNull(aggregation, "aggregation cannot be null");
    }

    public Aggregation getAggregation() {
        return aggregation;
    }

    @Override
    public boolean isMultivariate() {
        return true;
    }

    @Override
    protected double computeScore(double[] current, double[][] reference) {
        double normalizer = Math.sqrt(current.length);
        double min = Double.MAX_VALUE;
        double sum = 0;
        for (double[] row : reference) {
            double distance = distance(current, row) / normalizer;
            min = Math.min(min, distance);
            sum += distance;
        }
        return (aggregation == Aggregation.MIN) ? min : sum / reference.length;
    }

    static double distance(double[] a, double[] b) {
        double sum = 0;
        for (int i = 0; i < a.length; i++) {
            double t = a[i] - b[i];
            sum += t * t;
        }
        return Math.sqrt(sum);
    }
}

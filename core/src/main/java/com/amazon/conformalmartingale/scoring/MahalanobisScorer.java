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

import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularValueDecomposition;
import org.apache.commons.math3.stat.correlation.Covariance;

/**
 * sqrt((x - mu)' (Sigma + lambda I)^-1 (x - mu)) where mu and Sigma are the mean
 * and sample covariance of the reference. The ridge term lambda keeps the
 * matrix invertible for tiny or collinear references; the solve goes through a
 * singular value decomposition so that even a badly scaled matrix produces a
 * finite answer.
 */
public class MahalanobisScorer extends AbstractScorer {

    public static final double DEFAULT_REGULARIZATION = 1e-6;

    private final double regularization;

    public MahalanobisScorer() {
        this(DEFAULT_REGULARIZATION);
    }

    public MahalanobisScorer(double regularization) {
        checkArgument(regularization > 0, "regularization has to be positive");
        this.regularization = regularization;
    }

    public double getRegularization() {
        return regularization;
    }

    @Override
    public boolean isMultivariate() {
        return true;
    }

    @Override
    protected double computeScore(double[] current, double[][] reference) {
        int dimensions = current.length;
        double[] mean = new double[dimensions];
        for (double[] row : reference) {
            for (int j = 0; j < dimensions; j++) {
                mean[j] += row[j];
            }
        }
        for (int j = 0; j < dimensions; j++) {
            mean[j] /= reference.length;
        }

        RealMatrix covariance = new Covariance(reference, true).getCovarianceMatrix();
        for (int j = 0; j < dimensions; j++) {
            covariance.addToEntry(j, j, regularization);
        }

        RealVector difference = new ArrayRealVector(current).subtract(new ArrayRealVector(mean, false));
        RealVector solved = new SingularValueDecomposition(covariance).getSolver().solve(difference);
        double quadratic = difference.dotProduct(solved);
        if (Double.isNaN(quadratic) || quadratic <= 0) {
            return 0;
        }
        return Double.isInfinite(quadratic) ? Double.MAX_VALUE : Math.sqrt(quadratic);
    }
}

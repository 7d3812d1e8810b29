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

package com.amazon.conformalmartingale.martingale;

import static com.amazon.conformalmartingale.CommonUtils.checkArgument;
import static com.amazon.conformalmartingale.CommonUtils.checkNotNull;
import static com.amazon.conformalmartingale.CommonUtils.clip;

/**
 * The power martingale with betting function epsilon * p^(epsilon - 1). Small
 * p-values are rewarded; the smaller epsilon, the larger the reward and the
 * larger the loss on ordinary p-values.
 */
public class PowerMartingale extends AbstractMartingale {

    public static final double DEFAULT_EPSILON = 0.92;

    private final double epsilon;

    private double value;

    public PowerMartingale() {
        this(DEFAULT_EPSILON);
    }

    public PowerMartingale(double epsilon) {
        this(epsilon, 1.0);
    }

    public PowerMartingale(double epsilon, double value) {
        checkArgument(epsilon > 0 && epsilon < 1, "epsilon has to be in (0, 1)");
        checkArgument(value >= MIN_VALUE && value <= MAX_VALUE, "wealth out of range");
        this.epsilon = epsilon;
        this.value = value;
    }

    @Override
    protected double bet(double pValue) {
        value = clip(value * epsilon * Math.pow(pValue, epsilon - 1), MIN_VALUE, MAX_VALUE);
        return value;
    }

    @Override
    public double getValue() {
        return value;
    }

    public double getEpsilon() {
        return epsilon;
    }

    /**
     * the wealth of a fresh power martingale after each p-value, computed in log
     * space as a clipped running sum of log(epsilon) + (epsilon - 1) log(p)
     *
     * @param pValues the p-values, each in [0, 1]
     * @param epsilon the sensitivity in (0, 1)
     * @return the wealth sequence; agrees with {@link #apply(double[])} up to
     *         rounding
     */
    public static double[] cumulativeProduct(double[] pValues, double epsilon) {
        checkNotNull(pValues, "p-values cannot be null");
        checkArgument(epsilon > 0 && epsilon < 1, "epsilon has to be in (0, 1)");
        double logMin = Math.log(MIN_VALUE);
        double logMax = Math.log(MAX_VALUE);
        double logEpsilon = Math.log(epsilon);
        double[] answer = new double[pValues.length];
        double logValue = 0;
        for (int i = 0; i < pValues.length; i++) {
            double p = pValues[i];
            checkArgument(Double.isFinite(p) && p >= 0 && p <= 1, "p-values have to be in [0, 1], found " + p);
            logValue = clip(logValue + logEpsilon + (epsilon - 1) * Math.log(p), logMin, logMax);
            answer[i] = Math.exp(logValue);
        }
        return answer;
    }
}

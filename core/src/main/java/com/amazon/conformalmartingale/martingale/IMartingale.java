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

import static com.amazon.conformalmartingale.CommonUtils.checkNotNull;

/**
 * A betting strategy against exchangeability. Each p-value multiplies the
 * wealth by a betting factor whose expectation under uniform p-values is at
 * most 1, so by Ville's inequality the wealth exceeds 1/alpha with probability
 * at most alpha when nothing changes.
 */
public interface IMartingale {

    /**
     * lower bound of the wealth; keeps a long run of ordinary p-values from
     * underflowing to 0, from which no later evidence could recover
     */
    double MIN_VALUE = 1e-10;

    /**
     * upper bound of the wealth
     */
    double MAX_VALUE = 1e10;

    /**
     * bets on one p-value
     *
     * @param pValue a p-value in [0, 1]
     * @return the wealth after the bet
     */
    double update(double pValue);

    /**
     * @return the current wealth, 1 before the first update
     */
    double getValue();

    /**
     * @return the number of p-values seen
     */
    long getUpdates();

    /**
     * bets on a sequence of p-values starting from the current wealth
     *
     * @param pValues the p-values
     * @return the wealth after each p-value
     */
    default double[] apply(double[] pValues) {
        checkNotNull(pValues, "p-values cannot be null");
        double[] answer = new double[pValues.length];
        for (int i = 0; i < pValues.length; i++) {
            answer[i] = update(pValues[i]);
        }
        return answer;
    }
}

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

package com.amazon.conformalmartingale.services.threshold;

/**
 * A threshold for martingale values. The threshold for a value depends only on
 * the values seen before it.
 */
public interface IThreshold {

    /**
     * @return the bound the next martingale value is compared against
     */
    double getThreshold();

    /**
     * records a martingale value after it was compared
     *
     * @param martingaleValue the value; non-finite values are ignored
     */
    void update(double martingaleValue);

    /**
     * @param martingaleValue a martingale value
     * @return true if the value is finite and exceeds the current threshold
     */
    default boolean isCrossing(double martingaleValue) {
        return Double.isFinite(martingaleValue) && martingaleValue > getThreshold();
    }
}

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

package com.amazon.conformalmartingale.services.config;

import static com.amazon.conformalmartingale.CommonUtils.checkNotNull;

public enum ThresholdMode {

    /**
     * the Ville bound 1/alpha
     */
    FIXED,

    /**
     * the larger of 1/alpha and a multiple of a percentile of the recent
     * martingale values; follows the baseline volatility of the wealth process
     */
    ADAPTIVE;

    public static ThresholdMode fromName(String name) {
        checkNotNull(name, "threshold mode cannot be null");
        for (ThresholdMode mode : values()) {
            if (mode.name().equalsIgnoreCase(name)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("unknown threshold mode " + name);
    }
}

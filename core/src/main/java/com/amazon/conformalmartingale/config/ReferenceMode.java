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

/**
 * How the reference set a new observation is scored against evolves over time.
 */
public enum ReferenceMode {

    /**
     * the last referenceWindow observations, or all of them for a window of 0;
     * every observation is scored and calibrated
     */
    SLIDING,

    /**
     * the first referenceWindow observations, frozen once complete; those
     * observations only fit the scorer and produce no evidence, so the scores of
     * all later observations are exchangeable before a change
     */
    INDUCTIVE;

    /**
     * @param referenceWindow size of the reference set
     * @return the number of leading observations that only build the reference
     *         set
     */
    public int getTrainingLength(int referenceWindow) {
        return (this == INDUCTIVE) ? referenceWindow : 0;
    }

    public static ReferenceMode fromName(String name) {
        checkNotNull(name, "reference mode cannot be null");
        for (ReferenceMode mode : values()) {
            if (mode.name().equalsIgnoreCase(name)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("unknown reference mode " + name);
    }
}

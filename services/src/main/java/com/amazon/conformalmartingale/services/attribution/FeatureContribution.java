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

package com.amazon.conformalmartingale.services.attribution;

import lombok.Getter;
import lombok.ToString;

/**
 * How much one feature (or stream) moved across a change point.
 */
@Getter
@ToString
public class FeatureContribution {

    private final String name;

    /**
     * column of the feature in the data
     */
    private final int column;

    /**
     * |mean after - mean before| in units of the standard deviation before
     */
    private final double meanShift;

    /**
     * |std after - std before| in units of the standard deviation before
     */
    private final double spreadShift;

    public FeatureContribution(String name, int column, double meanShift, double spreadShift) {
        this.name = name;
        this.column = column;
        this.meanShift = meanShift;
        this.spreadShift = spreadShift;
    }

    public double getTotalShift() {
        return meanShift + spreadShift;
    }
}

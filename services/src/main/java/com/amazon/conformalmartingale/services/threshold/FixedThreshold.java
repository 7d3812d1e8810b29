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

import static com.amazon.conformalmartingale.CommonUtils.checkArgument;

/**
 * The constant threshold 1/alpha. By Ville's inequality a martingale started at
 * 1 exceeds it with probability at most alpha if the data are exchangeable.
 */
public class FixedThreshold implements IThreshold {

    private final double alpha;

    public FixedThreshold(double alpha) {
        checkArgument(alpha > 0 && alpha < 1, "alpha must be in (0, 1)");
        this.alpha = alpha;
    }

    @Override
    public double getThreshold() {
        return 1.0 / alpha;
    }

    @Override
    public void update(double martingaleValue) {
        // the bound does not depend on past values
    }

    public double getAlpha() {
        return alpha;
    }
}

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

public abstract class AbstractMartingale implements IMartingale {

    protected long updates;

    @Override
    public double update(double pValue) {
        checkArgument(Double.isFinite(pValue) && pValue >= 0 && pValue <= 1,
                "p-values have to be in [0, 1], found " + pValue);
        double answer = bet(pValue);
        ++updates;
        return answer;
    }

    /**
     * applies the betting factor of a validated p-value
     *
     * @param pValue a p-value in [0, 1]
     * @return the new wealth, within [MIN_VALUE, MAX_VALUE]
     */
    protected abstract double bet(double pValue);

    @Override
    public long getUpdates() {
        return updates;
    }

    public void setUpdates(long updates) {
        checkArgument(updates >= 0, "updates cannot be negative");
        this.updates = updates;
    }
}

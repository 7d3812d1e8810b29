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

import com.amazon.conformalmartingale.martingale.IMartingale;
import com.amazon.conformalmartingale.martingale.PowerMartingale;
import com.amazon.conformalmartingale.martingale.SimpleJumperMartingale;

public enum MartingaleKind {

    /**
     * bets with a single fixed exponent epsilon; cheap and sensitive when epsilon
     * is well chosen
     */
    POWER("power"),

    /**
     * a mixture over three betting directions with Markov switching, robust to a
     * poorly chosen epsilon
     */
    SIMPLE_JUMPER("simple_jumper");

    private final String configName;

    MartingaleKind(String configName) {
        this.configName = configName;
    }

    public String getConfigName() {
        return configName;
    }

    public static MartingaleKind fromName(String name) {
        checkNotNull(name, "martingale kind cannot be null");
        for (MartingaleKind kind : values()) {
            if (kind.configName.equalsIgnoreCase(name) || kind.name().equalsIgnoreCase(name)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("unknown martingale kind " + name);
    }

    /**
     * creates a fresh martingale with wealth 1
     *
     * @param epsilon         sensitivity of the power martingale
     * @param jumpProbability switching probability of the simple jumper
     * @return a new martingale
     */
    public IMartingale create(double epsilon, double jumpProbability) {
        if (this == POWER) {
            return new PowerMartingale(epsilon);
        }
        return new SimpleJumperMartingale(jumpProbability);
    }
}

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

package com.amazon.conformalmartingale.state.martingale;

import static com.amazon.conformalmartingale.state.Version.V1_0;

import java.io.Serializable;

import lombok.Data;

@Data
public class MartingaleState implements Serializable {

    private static final long serialVersionUID = 1L;

    private String version = V1_0;

    /**
     * configuration name of the martingale kind
     */
    private String kind;

    private double epsilon;

    private double jumpProbability;

    private long updates;

    /**
     * wealth of a power martingale
     */
    private double value;

    /**
     * wealth per betting direction of a simple jumper martingale, null otherwise
     */
    private double[] capital;
}

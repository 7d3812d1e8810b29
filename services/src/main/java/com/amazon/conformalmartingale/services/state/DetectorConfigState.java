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

package com.amazon.conformalmartingale.services.state;

import static com.amazon.conformalmartingale.state.Version.V1_0;

import java.io.Serializable;

import lombok.Data;

@Data
public class DetectorConfigState implements Serializable {

    private static final long serialVersionUID = 1L;

    private String version = V1_0;

    private int dimensions;

    private String scorerKind;

    private String martingaleKind;

    private double epsilon;

    private double jumpProbability;

    private double alpha;

    private String referenceMode;

    private int referenceWindow;

    private int calibrationWindow;

    private String thresholdMode;

    private int thresholdWindow;

    private double thresholdMultiplier;

    private double thresholdPercentile;

    private int minConsecutive;

    private double relativeTolerance;

    private double absoluteTolerance;

    private double regularization;

    private boolean useRandomizedPValue;

    private long randomSeed;

    private boolean parallelExecutionEnabled;

    private int threadPoolSize;

    private int attributionBefore;

    private int attributionAfter;
}

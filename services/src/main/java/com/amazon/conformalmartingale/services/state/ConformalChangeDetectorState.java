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

import com.amazon.conformalmartingale.state.martingale.MartingaleState;
import com.amazon.conformalmartingale.state.pvalue.ConformalPValueEngineState;

/**
 * A class that encapsulates the data of a {@link
 * com.amazon.conformalmartingale.services.ConformalChangeDetector} such that it
 * can be serialized and deserialized.
 */
@Data
public class ConformalChangeDetectorState implements Serializable {

    private static final long serialVersionUID = 1L;

    private String version = V1_0;

    private DetectorConfigState configState;

    /**
     * the reference set, oldest first
     */
    private double[][] history;

    private ConformalPValueEngineState pValueEngineState;

    private MartingaleState martingaleState;

    /**
     * recent martingale values of an adaptive threshold, oldest first; null for
     * a fixed threshold
     */
    private double[] thresholdValues;

    private String detectionState;

    private int runLength;

    private long index;
}

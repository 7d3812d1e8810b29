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

package com.amazon.conformalmartingale.services.returntypes;

import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import com.amazon.conformalmartingale.services.threshold.DetectionState;

/**
 * Everything the streaming detector computed for one observation.
 */
@Getter
@Setter
@ToString
public class ChangeDescriptor {

    /**
     * position of the observation in the stream, calibration data excluded
     */
    private long index;

    private double[] point;

    private double score;

    private double pValue;

    private double randomizedPValue;

    private double martingaleValue;

    private double threshold;

    private boolean crossing;

    private DetectionState detectionState;

    /**
     * number of observations, this one included, newly marked as detected
     */
    private int newlyDetected;

    /**
     * index of the first observation of the current run relative to this one (0
     * or negative); meaningful when the state is not BELOW
     */
    private int relativeIndexOfRunStart;

    public ChangeDescriptor(long index, double[] point) {
        this.index = index;
        this.point = point;
    }

    /**
     * @return true if the observation is part of a confirmed run
     */
    public boolean isDetection() {
        return detectionState == DetectionState.CONFIRMED;
    }

    /**
     * @return true if the run this observation belongs to was confirmed at this
     *         observation
     */
    public boolean isConfirmedNow() {
        return isDetection() && newlyDetected == 1 - relativeIndexOfRunStart;
    }
}

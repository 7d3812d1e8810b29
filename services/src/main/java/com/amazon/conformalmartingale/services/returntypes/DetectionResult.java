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

import java.util.Collections;
import java.util.List;
import java.util.stream.IntStream;

import lombok.Getter;

/**
 * The outcome of thresholding a martingale sequence. All arrays have the length
 * of the martingale sequence.
 */
@Getter
public class DetectionResult {

    /**
     * the threshold each value was compared against
     */
    private final double[] thresholds;

    /**
     * raw threshold crossings
     */
    private final boolean[] crossings;

    /**
     * crossings that belong to a confirmed run
     */
    private final boolean[] detections;

    /**
     * one event per raw crossing
     */
    private final List<DetectionEvent> events;

    public DetectionResult(double[] thresholds, boolean[] crossings, boolean[] detections,
            List<DetectionEvent> events) {
        this.thresholds = thresholds;
        this.crossings = crossings;
        this.detections = detections;
        this.events = Collections.unmodifiableList(events);
    }

    public int[] getDetectionIndices() {
        return IntStream.range(0, detections.length).filter(t -> detections[t]).toArray();
    }

    /**
     * @return the first index of every confirmed run
     */
    public int[] getChangePoints() {
        return IntStream.range(0, detections.length).filter(t -> detections[t] && (t == 0 || !detections[t - 1]))
                .toArray();
    }

    public boolean hasDetection() {
        return getChangePoints().length > 0;
    }
}

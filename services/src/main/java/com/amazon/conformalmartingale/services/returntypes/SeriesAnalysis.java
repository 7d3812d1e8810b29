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

import java.util.List;

import lombok.Getter;

/**
 * Parallel arrays describing every index of an analyzed series, together with
 * the detection result.
 */
@Getter
public class SeriesAnalysis {

    private final double[] scores;

    private final double[] pValues;

    private final double[] randomizedPValues;

    private final double[] martingale;

    private final DetectionResult detectionResult;

    public SeriesAnalysis(double[] scores, double[] pValues, double[] randomizedPValues, double[] martingale,
            DetectionResult detectionResult) {
        this.scores = scores;
        this.pValues = pValues;
        this.randomizedPValues = randomizedPValues;
        this.martingale = martingale;
        this.detectionResult = detectionResult;
    }

    public int size() {
        return scores.length;
    }

    public double[] getThresholds() {
        return detectionResult.getThresholds();
    }

    public boolean[] getDetections() {
        return detectionResult.getDetections();
    }

    public List<DetectionEvent> getEvents() {
        return detectionResult.getEvents();
    }

    public int[] getDetectionIndices() {
        return detectionResult.getDetectionIndices();
    }

    public int[] getChangePoints() {
        return detectionResult.getChangePoints();
    }
}

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

package com.amazon.conformalmartingale.services.calibration;

import static com.amazon.conformalmartingale.CommonUtils.checkArgument;
import static com.amazon.conformalmartingale.CommonUtils.checkFinite;
import static com.amazon.conformalmartingale.CommonUtils.checkNotNull;
import static com.amazon.conformalmartingale.CommonUtils.checkShape;

import java.util.Arrays;

import com.amazon.conformalmartingale.executor.IScoreExecutor;
import com.amazon.conformalmartingale.services.config.DetectorConfig;

/**
 * An immutable copy of a calibration segment: the observations and their
 * nonconformity scores. A detector seeded with a snapshot judges new data
 * against the segment as if it had processed it, but its martingale starts at
 * 1 after the segment. The same snapshot can seed any number of detectors.
 */
public class CalibrationSnapshot {

    private final double[][] observations;

    private final double[] scores;

    public CalibrationSnapshot(double[][] observations, double[] scores) {
        checkShape(observations);
        checkNotNull(scores, "scores cannot be null");
        checkArgument(observations.length == scores.length, "one score per observation is required");
        this.observations = new double[observations.length][];
        for (int i = 0; i < observations.length; i++) {
            this.observations[i] = Arrays.copyOf(observations[i], observations[i].length);
        }
        this.scores = Arrays.copyOf(scores, scores.length);
    }

    /**
     * scores a calibration segment with the scorer and reference window of a
     * configuration
     *
     * @param reference the calibration segment, rows are time
     * @param config    the configuration the snapshot is used with
     * @return the snapshot
     */
    public static CalibrationSnapshot calibrate(double[][] reference, DetectorConfig config) {
        checkNotNull(config, "config cannot be null");
        int dimensions = checkShape(reference);
        checkArgument(dimensions == config.getDimensions(), "calibration data does not match the dimensions");
        for (double[] row : reference) {
            checkFinite(row);
        }
        try (IScoreExecutor executor = config.createScoreExecutor()) {
            return new CalibrationSnapshot(reference, executor.score(reference));
        }
    }

    public int size() {
        return observations.length;
    }

    public int getDimensions() {
        return observations[0].length;
    }

    /**
     * @return a copy of the observations
     */
    public double[][] getObservations() {
        double[][] answer = new double[observations.length][];
        for (int i = 0; i < observations.length; i++) {
            answer[i] = Arrays.copyOf(observations[i], observations[i].length);
        }
        return answer;
    }

    /**
     * @return a copy of the scores
     */
    public double[] getScores() {
        return Arrays.copyOf(scores, scores.length);
    }
}

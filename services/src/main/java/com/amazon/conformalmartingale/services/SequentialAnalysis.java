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

package com.amazon.conformalmartingale.services;

import static com.amazon.conformalmartingale.CommonUtils.checkArgument;
import static com.amazon.conformalmartingale.CommonUtils.checkFinite;
import static com.amazon.conformalmartingale.CommonUtils.checkNotNull;
import static com.amazon.conformalmartingale.CommonUtils.checkShape;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.extern.slf4j.Slf4j;

import com.amazon.conformalmartingale.CommonUtils;
import com.amazon.conformalmartingale.executor.IScoreExecutor;
import com.amazon.conformalmartingale.martingale.IMartingale;
import com.amazon.conformalmartingale.pvalue.ConformalPValues;
import com.amazon.conformalmartingale.pvalue.PValueSequence;
import com.amazon.conformalmartingale.services.attribution.Attribution;
import com.amazon.conformalmartingale.services.attribution.ShiftAttributor;
import com.amazon.conformalmartingale.services.calibration.CalibrationSnapshot;
import com.amazon.conformalmartingale.services.config.DetectorConfig;
import com.amazon.conformalmartingale.services.returntypes.DetectionResult;
import com.amazon.conformalmartingale.services.returntypes.MultivariateAnalysis;
import com.amazon.conformalmartingale.services.returntypes.SeriesAnalysis;
import com.amazon.conformalmartingale.services.threshold.ChangeDetector;

/**
 * Batch replay over an already materialized series. Each stage runs over the
 * whole series before the next one starts, which allows the scoring stage to
 * run in parallel; the outputs are the same as those of a
 * {@link ConformalChangeDetector} fed one observation at a time.
 */
@Slf4j
public class SequentialAnalysis {

    private SequentialAnalysis() {
    }

    /**
     * @param series a univariate series
     * @param config a configuration with dimensions 1
     * @return scores, p-values, martingale and detections of every index
     */
    public static SeriesAnalysis detectChanges(double[] series, DetectorConfig config) {
        checkNotNull(series, "series cannot be null");
        return detectChanges(CommonUtils.toColumn(series), config);
    }

    /**
     * @param data   rows are time, columns are features; must be rectangular
     * @param config the configuration, dimensions must match the columns
     * @return scores, p-values, martingale and detections of every index
     */
    public static SeriesAnalysis detectChanges(double[][] data, DetectorConfig config) {
        return detectChanges(data, config, null);
    }

    /**
     * as above, where the data continue a calibration segment
     *
     * @param data     rows are time, columns are features
     * @param config   the configuration
     * @param snapshot calibration segment scored with the same configuration, may
     *                 be null
     * @return the analysis of the rows of data; the calibration rows are not
     *         included
     */
    public static SeriesAnalysis detectChanges(double[][] data, DetectorConfig config,
            CalibrationSnapshot snapshot) {
        checkNotNull(config, "config cannot be null");
        int dimensions = checkShape(data);
        checkArgument(dimensions == config.getDimensions(),
                "data has " + dimensions + " columns, expected " + config.getDimensions());
        double[][] rows = data;
        int offset = 0;
        if (snapshot != null) {
            checkArgument(snapshot.getDimensions() == dimensions, "calibration data does not match the dimensions");
            offset = snapshot.size();
            rows = new double[offset + data.length][];
            System.arraycopy(snapshot.getObservations(), 0, rows, 0, offset);
            System.arraycopy(data, 0, rows, offset, data.length);
        }
        for (double[] row : data) {
            checkFinite(row);
        }

        double[] allScores;
        try (IScoreExecutor executor = config.createScoreExecutor()) {
            allScores = executor.score(rows);
        }
        if (snapshot != null) {
            // the calibration scores are those the streaming detector is seeded with
            System.arraycopy(snapshot.getScores(), 0, allScores, 0, offset);
        }
        // training rows of an inductive reference set are not calibrated
        int training = Math.min(config.getTrainingLength(), rows.length);
        PValueSequence pValues = ConformalPValues.compute(Arrays.copyOfRange(allScores, training, rows.length),
                config.getCalibrationWindow(), config.getTieTolerance(), config.getRandomSeed());
        double[] allDeterministic = withTraining(pValues.getDeterministic(), training);
        double[] allRandomized = withTraining(pValues.getRandomized(), training);

        double[] scores = Arrays.copyOfRange(allScores, offset, allScores.length);
        double[] deterministic = Arrays.copyOfRange(allDeterministic, offset, allScores.length);
        double[] randomized = Arrays.copyOfRange(allRandomized, offset, allScores.length);
        double[] chosen = config.isUseRandomizedPValue() ? randomized : deterministic;
        int skipped = Math.max(0, training - offset);
        IMartingale wealth = config.createMartingale();
        double[] martingale = new double[data.length];
        Arrays.fill(martingale, 0, skipped, wealth.getValue());
        double[] values = wealth.apply(Arrays.copyOfRange(chosen, skipped, chosen.length));
        System.arraycopy(values, 0, martingale, skipped, values.length);
        DetectionResult result = new ChangeDetector(config).detect(martingale);
        log.debug("analyzed {} rows, {} change points", data.length, result.getChangePoints().length);
        return new SeriesAnalysis(scores, deterministic, randomized, martingale, result);
    }

    /**
     * prefixes calibrated p-values with p-values of 1 for the training rows
     */
    static double[] withTraining(double[] pValues, int training) {
        double[] answer = new double[training + pValues.length];
        Arrays.fill(answer, 0, training, 1.0);
        System.arraycopy(pValues, 0, answer, training, pValues.length);
        return answer;
    }

    /**
     * runs every column as its own stream, then the joint feature vector, and
     * attributes every change point of the joint analysis to the columns
     *
     * @param data              rows are time, columns are streams
     * @param names             a name per column, or null
     * @param univariateConfig  configuration of the per stream analyses, with
     *                          dimensions 1
     * @param multivariateConfig configuration of the joint analysis, with one
     *                          dimension per column and a multivariate scorer
     * @return the analyses and attributions
     */
    public static MultivariateAnalysis analyzeStreams(double[][] data, String[] names,
            DetectorConfig univariateConfig, DetectorConfig multivariateConfig) {
        int dimensions = checkShape(data);
        checkNotNull(univariateConfig, "univariate config cannot be null");
        checkNotNull(multivariateConfig, "multivariate config cannot be null");
        checkArgument(univariateConfig.getDimensions() == 1, "univariate config must have dimensions 1");
        checkArgument(names == null || names.length == dimensions, "one name per column is required");
        String[] streamNames = new String[dimensions];
        for (int j = 0; j < dimensions; j++) {
            streamNames[j] = (names == null) ? "feature_" + j : checkNotNull(names[j], "names cannot be null");
        }

        Map<String, SeriesAnalysis> streams = new LinkedHashMap<>();
        for (int j = 0; j < dimensions; j++) {
            checkArgument(!streams.containsKey(streamNames[j]), "duplicate stream name " + streamNames[j]);
            streams.put(streamNames[j], detectChanges(CommonUtils.getColumn(data, j), univariateConfig));
        }
        SeriesAnalysis joint = detectChanges(data, multivariateConfig);

        ShiftAttributor attributor = new ShiftAttributor(multivariateConfig.getAttributionBefore(),
                multivariateConfig.getAttributionAfter());
        List<Attribution> attributions = new ArrayList<>();
        for (int changePoint : joint.getChangePoints()) {
            attributions.add(attributor.attribute(data, changePoint, streamNames));
        }
        return new MultivariateAnalysis(streams, joint, attributions);
    }
}

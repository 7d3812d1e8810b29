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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.lessThanOrEqualTo;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.MethodSource;

import com.amazon.conformalmartingale.config.MartingaleKind;
import com.amazon.conformalmartingale.config.ReferenceMode;
import com.amazon.conformalmartingale.config.ScorerKind;
import com.amazon.conformalmartingale.services.attribution.Attribution;
import com.amazon.conformalmartingale.services.calibration.CalibrationSnapshot;
import com.amazon.conformalmartingale.services.config.DetectorConfig;
import com.amazon.conformalmartingale.services.config.ThresholdMode;
import com.amazon.conformalmartingale.services.returntypes.MultivariateAnalysis;
import com.amazon.conformalmartingale.services.returntypes.SeriesAnalysis;
import com.amazon.conformalmartingale.testutils.LevelShiftTestData;
import com.amazon.conformalmartingale.testutils.MultiDimDataWithKey;
import com.amazon.conformalmartingale.testutils.NormalMixtureTestData;

public class SequentialAnalysisTest {

    @ParameterizedTest
    @EnumSource(ThresholdMode.class)
    public void testMeanShift(ThresholdMode mode) {
        double[] series = LevelShiftTestData.univariate(200, 200, 5.0, 1.0, 42L);
        DetectorConfig config = DetectorConfig.builder().scorerKind(ScorerKind.ROBUST_MEAN_DEVIATION)
                .thresholdMode(mode).alpha(0.01).randomSeed(1L).build();
        SeriesAnalysis analysis = SequentialAnalysis.detectChanges(series, config);

        assertEquals(series.length, analysis.size());
        for (int t = 0; t < 200; t++) {
            assertTrue(!analysis.getDetections()[t], "no detection before the shift");
            assertTrue(analysis.getThresholds()[t] >= 100.0);
        }
        assertTrue(analysis.getDetectionResult().hasDetection());
        int[] changePoints = analysis.getChangePoints();
        assertThat(changePoints[0], greaterThanOrEqualTo(200));
        assertTrue(changePoints[0] < 350);
        for (int t = 0; t < series.length; t++) {
            assertTrue(analysis.getScores()[t] >= 0);
            assertTrue(analysis.getPValues()[t] > 0 && analysis.getPValues()[t] <= 1);
            assertTrue(analysis.getRandomizedPValues()[t] <= analysis.getPValues()[t]);
        }
    }

    static Stream<Arguments> martingalesAndThresholds() {
        return Stream.of(MartingaleKind.values())
                .flatMap(kind -> Stream.of(ThresholdMode.values()).map(mode -> Arguments.of(kind, mode)));
    }

    /**
     * 200 points of N(0, 1) followed by 200 points of N(5, 1), with the default
     * significance, sensitivity, reference size and persistence
     */
    @ParameterizedTest
    @MethodSource("martingalesAndThresholds")
    public void testDefaultMeanShift(MartingaleKind kind, ThresholdMode mode) {
        int runs = 20;
        int runsWithEarlyDetection = 0;
        for (int run = 0; run < runs; run++) {
            double[] series = LevelShiftTestData.univariate(200, 200, 5.0, 1.0, 1000L + run);
            DetectorConfig config = DetectorConfig.builder().alpha(0.05).epsilon(0.92).window(30)
                    .minConsecutive(3).martingaleKind(kind).thresholdMode(mode).randomSeed(run).build();
            SeriesAnalysis analysis = SequentialAnalysis.detectChanges(series, config);

            boolean early = false;
            for (int t = 0; t < 200; t++) {
                early |= analysis.getDetections()[t];
            }
            if (early) {
                ++runsWithEarlyDetection;
            }
            boolean detected = false;
            for (int t = 200; t < 300; t++) {
                detected |= analysis.getDetections()[t];
            }
            assertTrue(detected, "shift missed in run " + run);
        }
        // Ville's inequality bounds the chance of an early detection by alpha per run
        assertThat(runsWithEarlyDetection, lessThanOrEqualTo(3));
    }

    @Test
    public void testTrainingRows() {
        double[] series = LevelShiftTestData.univariate(100, 0, 0.0, 1.0, 12L);
        DetectorConfig config = DetectorConfig.builder().window(40).randomSeed(3L).build();
        SeriesAnalysis analysis = SequentialAnalysis.detectChanges(series, config);
        for (int t = 0; t < 40; t++) {
            assertEquals(0.0, analysis.getScores()[t]);
            assertEquals(1.0, analysis.getPValues()[t]);
            assertEquals(1.0, analysis.getRandomizedPValues()[t]);
            assertEquals(1.0, analysis.getMartingale()[t]);
        }
        assertTrue(analysis.getScores()[40] > 0);
        // the first calibrated score is ranked against itself only
        assertEquals(1.0, analysis.getPValues()[40]);
    }

    @Test
    public void testSimpleJumper() {
        double[] series = LevelShiftTestData.univariate(200, 200, 5.0, 1.0, 43L);
        DetectorConfig config = DetectorConfig.builder().martingaleKind(MartingaleKind.SIMPLE_JUMPER).randomSeed(2L)
                .build();
        SeriesAnalysis analysis = SequentialAnalysis.detectChanges(series, config);
        assertTrue(Arrays.stream(analysis.getChangePoints()).anyMatch(c -> c >= 200 && c < 400));
        assertEquals(1.0, analysis.getMartingale()[0], 1e-12);
    }

    @ParameterizedTest
    @EnumSource(ReferenceMode.class)
    public void testParallelScoring(ReferenceMode referenceMode) {
        double[][] data = new NormalMixtureTestData(0, 2).generateTestData(300, 2, 5L);
        DetectorConfig sequential = DetectorConfig.builder().dimensions(2).scorerKind(ScorerKind.MEAN_DISTANCE)
                .referenceMode(referenceMode).referenceWindow(50).randomSeed(3L).build();
        DetectorConfig parallel = sequential.toBuilder().parallelExecutionEnabled(true).threadPoolSize(4).build();
        SeriesAnalysis expected = SequentialAnalysis.detectChanges(data, sequential);
        SeriesAnalysis actual = SequentialAnalysis.detectChanges(data, parallel);
        assertArrayEquals(expected.getScores(), actual.getScores());
        assertArrayEquals(expected.getRandomizedPValues(), actual.getRandomizedPValues());
        assertArrayEquals(expected.getMartingale(), actual.getMartingale());
        assertArrayEquals(expected.getDetections(), actual.getDetections());
    }

    @Test
    public void testPoolThreadsReleased() throws InterruptedException {
        double[][] data = new NormalMixtureTestData(0, 2).generateTestData(100, 2, 6L);
        DetectorConfig config = DetectorConfig.builder().dimensions(2).scorerKind(ScorerKind.MEAN_DISTANCE)
                .parallelExecutionEnabled(true).threadPoolSize(4).randomSeed(7L).build();
        int before = countPoolWorkers();
        for (int i = 0; i < 50; i++) {
            SequentialAnalysis.detectChanges(data, config);
            CalibrationSnapshot.calibrate(data, config);
        }
        // workers of a shut down pool exit asynchronously
        long deadline = System.currentTimeMillis() + 10_000;
        while (countPoolWorkers() > before + 4 && System.currentTimeMillis() < deadline) {
            Thread.sleep(50);
        }
        assertThat(countPoolWorkers(), lessThanOrEqualTo(before + 4));
    }

    static int countPoolWorkers() {
        int count = 0;
        for (Thread thread : Thread.getAllStackTraces().keySet()) {
            if (thread.isAlive() && thread.getName().matches("ForkJoinPool-\\d+-worker-\\d+")) {
                ++count;
            }
        }
        return count;
    }

    @Test
    public void testAnalyzeStreams() {
        MultiDimDataWithKey data = LevelShiftTestData.generate(200, 200, new double[] { 0, 6, 0 }, 1.0, 11L);
        String[] names = new String[] { "cpu", "memory", "disk" };
        DetectorConfig univariate = DetectorConfig.builder().scorerKind(ScorerKind.ROBUST_MEAN_DEVIATION)
                .randomSeed(4L).build();
        DetectorConfig multivariate = DetectorConfig.builder().dimensions(3).scorerKind(ScorerKind.MAHALANOBIS)
                .martingaleKind(MartingaleKind.SIMPLE_JUMPER).attributionBefore(100).randomSeed(5L).build();

        MultivariateAnalysis analysis = SequentialAnalysis.analyzeStreams(data.data, names, univariate,
                multivariate);
        assertEquals(3, analysis.getStreams().size());
        assertEquals(Arrays.asList(names), Arrays.asList(analysis.getStreams().keySet().toArray(new String[0])));
        assertTrue(Arrays.stream(analysis.getStream("memory").getChangePoints()).anyMatch(c -> c >= 200));
        assertEquals(analysis.getJoint().getChangePoints().length, analysis.getAttributions().size());

        Attribution attribution = analysis.getAttributions().stream().filter(a -> a.getChangeIndex() >= 200)
                .findFirst().orElseThrow(() -> new AssertionError("no attribution after the shift"));
        assertThat(attribution.getTopContribution().getName(), is("memory"));
        assertEquals(1, attribution.getTopContribution().getColumn());
        assertEquals(3, attribution.getContributions().size());
    }

    @Test
    public void testDefaultNames() {
        double[][] data = new NormalMixtureTestData().generateTestData(50, 2, 8L);
        MultivariateAnalysis analysis = SequentialAnalysis.analyzeStreams(data, null,
                DetectorConfig.builder().build(),
                DetectorConfig.builder().dimensions(2).scorerKind(ScorerKind.MIN_DISTANCE).build());
        assertTrue(analysis.getStreams().containsKey("feature_0"));
        assertTrue(analysis.getStreams().containsKey("feature_1"));
    }

    @Test
    public void testInvalidInput() {
        DetectorConfig config = DetectorConfig.builder().dimensions(2).scorerKind(ScorerKind.MIN_DISTANCE).build();
        assertThrows(IllegalArgumentException.class,
                () -> SequentialAnalysis.detectChanges(new double[][] { { 1, 2 }, { 3 } }, config));
        assertThrows(IllegalArgumentException.class,
                () -> SequentialAnalysis.detectChanges(new double[][] { { 1 }, { 3 } }, config));
        assertThrows(IllegalArgumentException.class, () -> SequentialAnalysis.detectChanges(new double[0], config));
        assertThrows(IllegalArgumentException.class,
                () -> SequentialAnalysis.detectChanges(new double[] { 1, Double.NaN, 2 }, DetectorConfig.builder()
                        .scorerKind(ScorerKind.MIN_DISTANCE).build()));
        assertThrows(IllegalArgumentException.class, () -> SequentialAnalysis.analyzeStreams(
                new double[][] { { 1, 2 } }, new String[] { "a", "a" }, DetectorConfig.builder().build(), config));
        assertThrows(IllegalArgumentException.class, () -> SequentialAnalysis.analyzeStreams(
                new double[][] { { 1, 2 } }, new String[] { "a" }, DetectorConfig.builder().build(), config));
    }
}

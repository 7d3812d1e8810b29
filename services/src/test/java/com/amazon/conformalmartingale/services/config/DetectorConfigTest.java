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

package com.amazon.conformalmartingale.services.config;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.function.Supplier;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import com.amazon.conformalmartingale.config.MartingaleKind;
import com.amazon.conformalmartingale.config.ReferenceMode;
import com.amazon.conformalmartingale.config.ScorerKind;
import com.amazon.conformalmartingale.executor.IScoreExecutor;
import com.amazon.conformalmartingale.executor.ParallelScoreExecutor;
import com.amazon.conformalmartingale.executor.SequentialScoreExecutor;
import com.amazon.conformalmartingale.martingale.SimpleJumperMartingale;
import com.amazon.conformalmartingale.services.threshold.AdaptiveThreshold;
import com.amazon.conformalmartingale.services.threshold.FixedThreshold;

public class DetectorConfigTest {

    @Test
    public void testDefaults() {
        DetectorConfig config = DetectorConfig.builder().build();
        assertEquals(1, config.getDimensions());
        assertEquals(ScorerKind.MEAN_DEVIATION, config.getScorerKind());
        assertEquals(MartingaleKind.POWER, config.getMartingaleKind());
        assertEquals(0.92, config.getEpsilon());
        assertEquals(0.01, config.getJumpProbability());
        assertEquals(0.05, config.getAlpha());
        assertEquals(20.0, config.getFixedThreshold(), 1e-12);
        assertEquals(ReferenceMode.INDUCTIVE, config.getReferenceMode());
        assertEquals(30, config.getReferenceWindow());
        assertEquals(30, config.getTrainingLength());
        assertEquals(0, config.getCalibrationWindow());
        assertEquals(ThresholdMode.FIXED, config.getThresholdMode());
        assertEquals(30, config.getThresholdWindow());
        assertEquals(1.0, config.getThresholdMultiplier());
        assertEquals(95.0, config.getThresholdPercentile());
        assertEquals(3, config.getMinConsecutive());
        assertEquals(1e-5, config.getRelativeTolerance());
        assertEquals(1e-8, config.getAbsoluteTolerance());
        assertEquals(1e-6, config.getRegularization());
        assertTrue(config.isUseRandomizedPValue());
        assertFalse(config.isParallelExecutionEnabled());
        assertEquals(Runtime.getRuntime().availableProcessors(), config.getThreadPoolSize());
        assertEquals(30, config.getAttributionBefore());
        assertEquals(10, config.getAttributionAfter());
        assertThat(config.createThreshold(), instanceOf(FixedThreshold.class));
        assertThat(config.createScoreExecutor(), instanceOf(SequentialScoreExecutor.class));
    }

    @Test
    public void testResolution() {
        DetectorConfig config = DetectorConfig.builder().dimensions(3).scorerKind("mahalanobis")
                .martingaleKind("simple_jumper").jumpProbability(0.2).thresholdMode(ThresholdMode.ADAPTIVE)
                .window(50).parallelExecutionEnabled(true).threadPoolSize(2).build();
        assertEquals(ScorerKind.MAHALANOBIS, config.getScorerKind());
        assertEquals(50, config.getReferenceWindow());
        assertEquals(0, config.getCalibrationWindow());
        assertEquals(ReferenceMode.SLIDING,
                DetectorConfig.builder().referenceMode("sliding").build().getReferenceMode());
        assertEquals(0, DetectorConfig.builder().referenceMode(ReferenceMode.SLIDING).build().getTrainingLength());
        assertThat(config.createThreshold(), instanceOf(AdaptiveThreshold.class));
        try (IScoreExecutor executor = config.createScoreExecutor()) {
            assertThat(executor, instanceOf(ParallelScoreExecutor.class));
            assertEquals(ReferenceMode.INDUCTIVE, ((ParallelScoreExecutor) executor).getReferenceMode());
        }
        assertEquals(0.2, ((SimpleJumperMartingale) config.createMartingale()).getJumpProbability());
        assertEquals(1e-5, config.getTieTolerance().getRelativeTolerance());
    }

    @Test
    public void testSeed() {
        DetectorConfig config = DetectorConfig.builder().build();
        // the seed is drawn once, a copy keeps it
        assertEquals(config.getRandomSeed(), config.toBuilder().build().getRandomSeed());
        assertEquals(42L, DetectorConfig.builder().randomSeed(42L).build().getRandomSeed());
    }

    @Test
    public void testToBuilder() {
        DetectorConfig config = DetectorConfig.builder().dimensions(2).scorerKind(ScorerKind.MIN_DISTANCE)
                .epsilon(0.5).alpha(0.01).referenceMode(ReferenceMode.SLIDING).referenceWindow(10)
                .calibrationWindow(20).thresholdWindow(5).thresholdMultiplier(2.0).thresholdPercentile(90)
                .minConsecutive(4).useRandomizedPValue(false).attributionBefore(50).attributionAfter(5)
                .randomSeed(3L).build();
        DetectorConfig copy = config.toBuilder().build();
        assertEquals(config.toString(), copy.toString());
        assertEquals(config.getMinConsecutive(), copy.getMinConsecutive());
        assertEquals(ReferenceMode.SLIDING, copy.getReferenceMode());
        assertFalse(copy.isUseRandomizedPValue());
    }

    static Stream<Supplier<DetectorConfig>> invalidConfigs() {
        return Stream.of(() -> DetectorConfig.builder().alpha(0).build(),
                () -> DetectorConfig.builder().alpha(1).build(), () -> DetectorConfig.builder().epsilon(1).build(),
                () -> DetectorConfig.builder().epsilon(0).build(),
                () -> DetectorConfig.builder().jumpProbability(1.5).build(),
                () -> DetectorConfig.builder().window(-1).build(),
                () -> DetectorConfig.builder().referenceWindow(-1).build(),
                () -> DetectorConfig.builder().referenceWindow(0).build(),
                () -> DetectorConfig.builder().referenceWindow(1).build(),
                () -> DetectorConfig.builder().referenceMode("expanding").build(),
                () -> DetectorConfig.builder().thresholdWindow(0).build(),
                () -> DetectorConfig.builder().thresholdMultiplier(0).build(),
                () -> DetectorConfig.builder().thresholdPercentile(0).build(),
                () -> DetectorConfig.builder().thresholdPercentile(101).build(),
                () -> DetectorConfig.builder().minConsecutive(0).build(),
                () -> DetectorConfig.builder().relativeTolerance(-1).build(),
                () -> DetectorConfig.builder().relativeTolerance(Double.POSITIVE_INFINITY).build(),
                () -> DetectorConfig.builder().absoluteTolerance(Double.POSITIVE_INFINITY).build(),
                () -> DetectorConfig.builder().absoluteTolerance(Double.NaN).build(),
                () -> DetectorConfig.builder().regularization(Double.POSITIVE_INFINITY).build(),
                () -> DetectorConfig.builder().regularization(0).build(),
                () -> DetectorConfig.builder().dimensions(0).build(),
                () -> DetectorConfig.builder().threadPoolSize(0).build(),
                () -> DetectorConfig.builder().attributionAfter(0).build(),
                () -> DetectorConfig.builder().dimensions(2).build(),
                () -> DetectorConfig.builder().dimensions(2).scorerKind(ScorerKind.ROBUST_MEAN_DEVIATION).build(),
                () -> DetectorConfig.builder().scorerKind("nearest_neighbor").build(),
                () -> DetectorConfig.builder().martingaleKind("mixture").build());
    }

    @ParameterizedTest
    @MethodSource("invalidConfigs")
    public void testInvalidConfiguration(Supplier<DetectorConfig> supplier) {
        assertThrows(IllegalArgumentException.class, supplier::get);
    }

    @Test
    public void testThresholdModeNames() {
        assertEquals(ThresholdMode.ADAPTIVE, ThresholdMode.fromName("adaptive"));
        assertThrows(IllegalArgumentException.class, () -> ThresholdMode.fromName("rolling"));
    }
}

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

package com.amazon.conformalmartingale.services.threshold;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

import com.amazon.conformalmartingale.services.config.DetectorConfig;
import com.amazon.conformalmartingale.services.config.ThresholdMode;
import com.amazon.conformalmartingale.services.returntypes.DetectionEvent;
import com.amazon.conformalmartingale.services.returntypes.DetectionResult;

public class ChangeDetectorTest {

    private static final double[] MARTINGALE = { 1, 25, 30, 5, 21, 22, 23, 24, Double.NaN, 30,
            Double.POSITIVE_INFINITY, 2 };

    @Test
    public void testFixedThreshold() {
        ChangeDetector detector = new ChangeDetector(() -> new FixedThreshold(0.05), 3);
        DetectionResult result = detector.detect(MARTINGALE);
        boolean[] crossings = { false, true, true, false, true, true, true, true, false, true, false, false };
        assertArrayEquals(crossings, result.getCrossings());
        assertArrayEquals(new int[] { 4, 5, 6, 7 }, result.getDetectionIndices());
        assertArrayEquals(new int[] { 4 }, result.getChangePoints());
        assertTrue(result.hasDetection());
        for (double threshold : result.getThresholds()) {
            assertEquals(20.0, threshold, 1e-12);
        }

        List<DetectionEvent> events = result.getEvents();
        assertEquals(Arrays.asList(1, 2, 4, 5, 6, 7, 9),
                events.stream().map(DetectionEvent::getIndex).collect(Collectors.toList()));
        assertEquals(Arrays.asList(false, false, true, true, true, true, false),
                events.stream().map(DetectionEvent::isPersisted).collect(Collectors.toList()));
        assertEquals(new DetectionEvent(4, true), events.get(2));
    }

    @Test
    public void testMinConsecutiveOne() {
        DetectionResult result = new ChangeDetector(() -> new FixedThreshold(0.05), 1).detect(MARTINGALE);
        assertArrayEquals(result.getCrossings(), result.getDetections());
        assertArrayEquals(new int[] { 1, 4, 9 }, result.getChangePoints());
        assertTrue(result.getEvents().stream().allMatch(DetectionEvent::isPersisted));
    }

    @Test
    public void testNonFiniteValuesNeverCross() {
        double[] martingale = new double[20];
        Arrays.fill(martingale, Double.POSITIVE_INFINITY);
        martingale[5] = Double.NaN;
        DetectionResult result = new ChangeDetector(() -> new FixedThreshold(0.05), 1).detect(martingale);
        assertFalse(result.hasDetection());
        assertEquals(0, result.getEvents().size());

        // the adaptive threshold ignores them as well
        DetectionResult adaptive = ChangeDetector.detect(martingale, 5, 1.0, 1);
        assertFalse(adaptive.hasDetection());
        assertEquals(20.0, adaptive.getThresholds()[19], 1e-12);
    }

    @Test
    public void testAdaptiveThreshold() {
        // a wealth process that stays at a high level
        double[] martingale = new double[200];
        Arrays.fill(martingale, 100);
        martingale[150] = 1000;
        martingale[151] = 1100;
        martingale[152] = 1200;

        DetectionResult fixed = new ChangeDetector(() -> new FixedThreshold(0.05), 3).detect(martingale);
        assertEquals(200, fixed.getDetectionIndices().length);

        DetectionResult adaptive = ChangeDetector.detect(martingale, 30, 1.0, 3);
        // only the burst stands out against the recent level
        assertArrayEquals(new int[] { 150 }, adaptive.getChangePoints());
        assertArrayEquals(new int[] { 150, 151, 152 }, adaptive.getDetectionIndices());
        assertEquals(20.0, adaptive.getThresholds()[0], 1e-12);
        assertEquals(100.0, adaptive.getThresholds()[149], 1e-12);
    }

    @Test
    public void testConfiguredDetector() {
        DetectorConfig config = DetectorConfig.builder().thresholdMode(ThresholdMode.ADAPTIVE).thresholdWindow(10)
                .minConsecutive(2).build();
        ChangeDetector detector = new ChangeDetector(config);
        assertEquals(2, detector.getMinConsecutive());
        DetectionResult first = detector.detect(MARTINGALE);
        // every call starts from a fresh threshold
        DetectionResult second = detector.detect(MARTINGALE);
        assertArrayEquals(first.getThresholds(), second.getThresholds());
        assertArrayEquals(first.getDetections(), second.getDetections());
    }

    @Test
    public void testThresholdIsConsultedBeforeUpdate() {
        IThreshold threshold = mock(IThreshold.class);
        when(threshold.getThreshold()).thenReturn(10.0);
        when(threshold.isCrossing(15.0)).thenReturn(true);
        DetectionResult result = new ChangeDetector(() -> threshold, 1).detect(new double[] { 15.0 });
        assertArrayEquals(new boolean[] { true }, result.getDetections());
        assertEquals(10.0, result.getThresholds()[0]);
        verify(threshold, times(1)).update(15.0);
    }

    @Test
    public void testInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> new ChangeDetector(() -> new FixedThreshold(0.05), 0));
        assertThrows(NullPointerException.class,
                () -> new ChangeDetector(() -> new FixedThreshold(0.05), 1).detect(null));
        assertThrows(IllegalArgumentException.class, () -> ChangeDetector.detect(MARTINGALE, 0, 1.0, 3));
    }
}

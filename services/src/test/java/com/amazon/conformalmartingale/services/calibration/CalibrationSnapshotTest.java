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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import com.amazon.conformalmartingale.config.ReferenceMode;
import com.amazon.conformalmartingale.config.ScorerKind;
import com.amazon.conformalmartingale.executor.IScoreExecutor;
import com.amazon.conformalmartingale.services.config.DetectorConfig;
import com.amazon.conformalmartingale.testutils.NormalMixtureTestData;

public class CalibrationSnapshotTest {

    @Test
    public void testCalibrate() {
        double[][] reference = new NormalMixtureTestData().generateTestData(80, 2, 3L);
        DetectorConfig config = DetectorConfig.builder().dimensions(2).scorerKind(ScorerKind.MAHALANOBIS)
                .referenceWindow(30).build();
        CalibrationSnapshot snapshot = CalibrationSnapshot.calibrate(reference, config);
        assertEquals(80, snapshot.size());
        assertEquals(2, snapshot.getDimensions());
        try (IScoreExecutor executor = config.createScoreExecutor()) {
            assertArrayEquals(executor.score(reference), snapshot.getScores());
        }
        // the training rows of the reference set
        for (int i = 0; i < 30; i++) {
            assertEquals(0.0, snapshot.getScores()[i]);
        }
        assertTrue(snapshot.getScores()[30] > 0);
    }

    @Test
    public void testCalibrateSliding() {
        double[][] reference = new NormalMixtureTestData().generateTestData(80, 2, 3L);
        DetectorConfig config = DetectorConfig.builder().dimensions(2).scorerKind(ScorerKind.MAHALANOBIS)
                .referenceMode(ReferenceMode.SLIDING).referenceWindow(30).parallelExecutionEnabled(true)
                .threadPoolSize(2).build();
        CalibrationSnapshot snapshot = CalibrationSnapshot.calibrate(reference, config);
        assertEquals(0.0, snapshot.getScores()[0]);
        assertEquals(0.0, snapshot.getScores()[1]);
        assertTrue(snapshot.getScores()[2] > 0);
    }

    @Test
    public void testCopies() {
        double[][] observations = new double[][] { { 1 }, { 2 }, { 3 } };
        double[] scores = new double[] { 0, 0, 1 };
        CalibrationSnapshot snapshot = new CalibrationSnapshot(observations, scores);
        observations[0][0] = 10;
        scores[2] = 5;
        assertEquals(1.0, snapshot.getObservations()[0][0]);
        assertEquals(1.0, snapshot.getScores()[2]);
        snapshot.getObservations()[1][0] = 10;
        snapshot.getScores()[0] = 10;
        assertEquals(2.0, snapshot.getObservations()[1][0]);
        assertEquals(0.0, snapshot.getScores()[0]);
    }

    @Test
    public void testInvalid() {
        assertThrows(IllegalArgumentException.class,
                () -> new CalibrationSnapshot(new double[][] { { 1 }, { 2 } }, new double[] { 0 }));
        assertThrows(IllegalArgumentException.class,
                () -> new CalibrationSnapshot(new double[][] { { 1 }, { 2, 3 } }, new double[] { 0, 0 }));
        assertThrows(NullPointerException.class, () -> new CalibrationSnapshot(new double[][] { { 1 } }, null));
        assertThrows(IllegalArgumentException.class, () -> CalibrationSnapshot
                .calibrate(new double[][] { { 1, 2 } }, DetectorConfig.builder().build()));
        assertThrows(IllegalArgumentException.class, () -> CalibrationSnapshot
                .calibrate(new double[][] { { 1 }, { Double.POSITIVE_INFINITY } }, DetectorConfig.builder().build()));
    }
}

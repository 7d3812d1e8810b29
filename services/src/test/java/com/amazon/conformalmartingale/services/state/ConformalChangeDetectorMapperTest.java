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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import com.amazon.conformalmartingale.config.MartingaleKind;
import com.amazon.conformalmartingale.config.ReferenceMode;
import com.amazon.conformalmartingale.config.ScorerKind;
import com.amazon.conformalmartingale.services.ConformalChangeDetector;
import com.amazon.conformalmartingale.services.config.DetectorConfig;
import com.amazon.conformalmartingale.services.config.ThresholdMode;
import com.amazon.conformalmartingale.services.returntypes.ChangeDescriptor;
import com.amazon.conformalmartingale.testutils.LevelShiftTestData;
import com.fasterxml.jackson.databind.ObjectMapper;

public class ConformalChangeDetectorMapperTest {

    static Stream<DetectorConfig> configs() {
        return Stream.of(DetectorConfig.builder().randomSeed(1L).build(),
                DetectorConfig.builder().scorerKind(ScorerKind.ROBUST_MEAN_DEVIATION)
                        .martingaleKind(MartingaleKind.SIMPLE_JUMPER).thresholdMode(ThresholdMode.ADAPTIVE)
                        .thresholdWindow(15).window(60).randomSeed(2L).build(),
                DetectorConfig.builder().scorerKind(ScorerKind.MIN_DISTANCE).minConsecutive(2)
                        .referenceMode(ReferenceMode.SLIDING).useRandomizedPValue(false).calibrationWindow(40)
                        .randomSeed(3L).build(),
                // restored while the reference set is still being filled
                DetectorConfig.builder().window(200).randomSeed(4L).build());
    }

    @ParameterizedTest
    @MethodSource("configs")
    public void testRoundTrip(DetectorConfig config) throws Exception {
        double[] series = LevelShiftTestData.univariate(150, 150, 4.0, 1.0, 9L);
        ConformalChangeDetector detector = new ConformalChangeDetector(config);
        // stop inside the shifted segment so that the filter and the martingale are
        // far from their initial state
        int stop = 170;
        for (int t = 0; t < stop; t++) {
            detector.process(series[t]);
        }

        ConformalChangeDetectorMapper mapper = new ConformalChangeDetectorMapper();
        ConformalChangeDetectorState state = mapper.toState(detector);
        ObjectMapper jsonMapper = new ObjectMapper();
        ConformalChangeDetectorState restoredState = jsonMapper
                .readValue(jsonMapper.writeValueAsString(state), ConformalChangeDetectorState.class);
        assertEquals(state.getIndex(), restoredState.getIndex());
        assertEquals(state.getDetectionState(), restoredState.getDetectionState());

        ConformalChangeDetector restored = mapper.toModel(restoredState);
        assertEquals(stop, restored.getIndex());
        assertArrayEquals(detector.getReferenceSet(), restored.getReferenceSet());
        assertEquals(detector.getPersistenceFilter().getState(), restored.getPersistenceFilter().getState());
        assertEquals(detector.getMartingale().getValue(), restored.getMartingale().getValue());

        for (int t = stop; t < series.length; t++) {
            ChangeDescriptor expected = detector.process(series[t]);
            ChangeDescriptor actual = restored.process(series[t]);
            assertEquals(expected.getScore(), actual.getScore());
            assertEquals(expected.getPValue(), actual.getPValue());
            assertEquals(expected.getRandomizedPValue(), actual.getRandomizedPValue());
            assertEquals(expected.getMartingaleValue(), actual.getMartingaleValue());
            assertEquals(expected.getThreshold(), actual.getThreshold());
            assertEquals(expected.getDetectionState(), actual.getDetectionState());
            assertEquals(expected.getNewlyDetected(), actual.getNewlyDetected());
        }
    }

    @Test
    public void testUnknownVersion() {
        ConformalChangeDetectorMapper mapper = new ConformalChangeDetectorMapper();
        ConformalChangeDetectorState state = mapper.toState(new ConformalChangeDetector(DetectorConfig.builder()
                .build()));
        state.setVersion("0.1");
        assertThrows(IllegalArgumentException.class, () -> mapper.toModel(state));
    }
}

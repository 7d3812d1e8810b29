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

package com.amazon.conformalmartingale.examples.detection;

import java.util.Arrays;

import com.amazon.conformalmartingale.config.ScorerKind;
import com.amazon.conformalmartingale.examples.Example;
import com.amazon.conformalmartingale.services.ConformalChangeDetector;
import com.amazon.conformalmartingale.services.calibration.CalibrationSnapshot;
import com.amazon.conformalmartingale.services.config.DetectorConfig;
import com.amazon.conformalmartingale.services.returntypes.ChangeDescriptor;
import com.amazon.conformalmartingale.testutils.LevelShiftTestData;
import com.amazon.conformalmartingale.testutils.MultiDimDataWithKey;

/**
 * A detector seeded from a segment of historical data, so that the first live
 * observations are already compared with a full reference and calibration set.
 */
public class CalibratedStreamExample implements Example {

    public static void main(String[] args) throws Exception {
        new CalibratedStreamExample().run();
    }

    @Override
    public String command() {
        return "calibrated_stream";
    }

    @Override
    public String description() {
        return "seed a detector with historical data before streaming";
    }

    @Override
    public void run() throws Exception {
        int dimensions = 2;
        int historical = 200;
        MultiDimDataWithKey data = LevelShiftTestData.generate(historical + 100, 100, new double[] { 0, 3 }, 1.0,
                17L);
        double[][] reference = Arrays.copyOfRange(data.data, 0, historical);
        double[][] live = Arrays.copyOfRange(data.data, historical, data.data.length);

        DetectorConfig config = DetectorConfig.builder().dimensions(dimensions).scorerKind(ScorerKind.MIN_DISTANCE)
                .window(150).randomSeed(17L).build();
        CalibrationSnapshot snapshot = CalibrationSnapshot.calibrate(reference, config);
        ConformalChangeDetector detector = new ConformalChangeDetector(config, snapshot);

        System.out.printf("calibrated with %d observations, change expected at live index %d%n", snapshot.size(),
                data.changeIndices[0] - historical);
        for (double[] point : live) {
            ChangeDescriptor result = detector.process(point);
            if (result.isConfirmedNow()) {
                System.out.printf("change confirmed at live index %d, martingale %.2f above %.2f%n",
                        result.getIndex(), result.getMartingaleValue(), result.getThreshold());
            }
        }
    }
}

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

package com.amazon.conformalmartingale.examples.serialization;

import com.amazon.conformalmartingale.config.ScorerKind;
import com.amazon.conformalmartingale.examples.Example;
import com.amazon.conformalmartingale.serialize.ConformalChangeDetectorSerDe;
import com.amazon.conformalmartingale.services.ConformalChangeDetector;
import com.amazon.conformalmartingale.services.config.DetectorConfig;
import com.amazon.conformalmartingale.services.config.ThresholdMode;
import com.amazon.conformalmartingale.services.returntypes.ChangeDescriptor;
import com.amazon.conformalmartingale.testutils.NormalMixtureTestData;

/**
 * Serialize a change detector to JSON using
 * <a href="https://github.com/google/gson">Gson</a>.
 */
public class JsonExample implements Example {

    public static void main(String[] args) throws Exception {
        new JsonExample().run();
    }

    @Override
    public String command() {
        return "json";
    }

    @Override
    public String description() {
        return "serialize a change detector as a JSON string";
    }

    @Override
    public void run() throws Exception {
        // Create and populate a detector

        int dimensions = 3;
        int window = 200;
        DetectorConfig config = DetectorConfig.builder().dimensions(dimensions).scorerKind(ScorerKind.MAHALANOBIS)
                .window(window).thresholdMode(ThresholdMode.ADAPTIVE).randomSeed(42L).build();
        ConformalChangeDetector detector = new ConformalChangeDetector(config);

        NormalMixtureTestData testData = new NormalMixtureTestData();
        for (double[] point : testData.generateTestData(2 * window, dimensions, 0L)) {
            detector.process(point);
        }

        // Convert to JSON and print the number of bytes

        ConformalChangeDetectorSerDe serDe = new ConformalChangeDetectorSerDe();
        String json = serDe.toJson(detector);

        System.out.printf("dimensions = %d, window = %d%n", dimensions, window);
        System.out.printf("JSON size = %d bytes%n", json.getBytes().length);

        // Restore from JSON and compare the two detectors on new data

        ConformalChangeDetector detector2 = serDe.fromJson(json);

        int testSize = 100;
        int differences = 0;
        for (double[] point : testData.generateTestData(testSize, dimensions, 1L)) {
            ChangeDescriptor result = detector.process(point);
            ChangeDescriptor result2 = detector2.process(point);
            if (result.getMartingaleValue() != result2.getMartingaleValue()
                    || result.getDetectionState() != result2.getDetectionState()) {
                differences++;
            }
        }

        if (differences > 0) {
            throw new IllegalStateException("restored detector does not agree with original detector");
        }

        System.out.println("Looks good!");
    }
}

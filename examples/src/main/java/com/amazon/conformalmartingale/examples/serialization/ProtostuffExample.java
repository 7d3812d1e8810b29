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

import com.amazon.conformalmartingale.config.MartingaleKind;
import com.amazon.conformalmartingale.config.ScorerKind;
import com.amazon.conformalmartingale.examples.Example;
import com.amazon.conformalmartingale.services.ConformalChangeDetector;
import com.amazon.conformalmartingale.services.config.DetectorConfig;
import com.amazon.conformalmartingale.services.returntypes.ChangeDescriptor;
import com.amazon.conformalmartingale.services.state.ConformalChangeDetectorMapper;
import com.amazon.conformalmartingale.services.state.ConformalChangeDetectorState;
import com.amazon.conformalmartingale.testutils.NormalMixtureTestData;

import io.protostuff.LinkedBuffer;
import io.protostuff.ProtostuffIOUtil;
import io.protostuff.Schema;
import io.protostuff.runtime.RuntimeSchema;

/**
 * Serialize a change detector using the
 * <a href="https://github.com/protostuff/protostuff">protostuff</a> library.
 */
public class ProtostuffExample implements Example {
    public static void main(String[] args) throws Exception {
        new ProtostuffExample().run();
    }

    @Override
    public String command() {
        return "protostuff";
    }

    @Override
    public String description() {
        return "serialize a change detector with the protostuff library";
    }

    @Override
    public void run() throws Exception {
        // Create and populate a detector

        int dimensions = 2;
        int window = 500;
        DetectorConfig config = DetectorConfig.builder().dimensions(dimensions).scorerKind(ScorerKind.MEAN_DISTANCE)
                .martingaleKind(MartingaleKind.SIMPLE_JUMPER).window(window).randomSeed(7L).build();
        ConformalChangeDetector detector = new ConformalChangeDetector(config);

        NormalMixtureTestData testData = new NormalMixtureTestData();
        for (double[] point : testData.generateTestData(2 * window, dimensions, 0L)) {
            detector.process(point);
        }

        // Convert to an array of bytes and print the size

        ConformalChangeDetectorMapper mapper = new ConformalChangeDetectorMapper();
        Schema<ConformalChangeDetectorState> schema = RuntimeSchema.getSchema(ConformalChangeDetectorState.class);
        LinkedBuffer buffer = LinkedBuffer.allocate(512);
        byte[] bytes;
        try {
            ConformalChangeDetectorState state = mapper.toState(detector);
            bytes = ProtostuffIOUtil.toByteArray(state, schema, buffer);
        } finally {
            buffer.clear();
        }

        System.out.printf("dimensions = %d, window = %d%n", dimensions, window);
        System.out.printf("protostuff size = %d bytes%n", bytes.length);

        // Restore from protostuff and compare the outputs of the two detectors

        ConformalChangeDetectorState state2 = schema.newMessage();
        ProtostuffIOUtil.mergeFrom(bytes, state2, schema);
        ConformalChangeDetector detector2 = mapper.toModel(state2);

        int testSize = 100;
        int differences = 0;
        for (double[] point : testData.generateTestData(testSize, dimensions, 1L)) {
            ChangeDescriptor result = detector.process(point);
            ChangeDescriptor result2 = detector2.process(point);
            if (result.getScore() != result2.getScore() || result.getMartingaleValue() != result2.getMartingaleValue()) {
                differences++;
            }
        }

        if (differences > 0) {
            throw new IllegalStateException("restored detector does not agree with original detector");
        }

        System.out.println("Looks good!");
    }
}

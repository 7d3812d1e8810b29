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

package com.amazon.conformalmartingale;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.OperationsPerInvocation;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;

import com.amazon.conformalmartingale.config.MartingaleKind;
import com.amazon.conformalmartingale.config.ReferenceMode;
import com.amazon.conformalmartingale.config.ScorerKind;
import com.amazon.conformalmartingale.services.ConformalChangeDetector;
import com.amazon.conformalmartingale.services.SequentialAnalysis;
import com.amazon.conformalmartingale.services.config.DetectorConfig;
import com.amazon.conformalmartingale.services.config.ThresholdMode;
import com.amazon.conformalmartingale.services.returntypes.ChangeDescriptor;
import com.amazon.conformalmartingale.services.returntypes.SeriesAnalysis;
import com.amazon.conformalmartingale.testutils.NormalMixtureTestData;

@Warmup(iterations = 5)
@Measurement(iterations = 10)
@Fork(value = 1)
@State(Scope.Thread)
public class ConformalChangeDetectorBenchmark {

    public final static int DATA_SIZE = 10_000;

    @State(Scope.Benchmark)
    public static class BenchmarkState {
        @Param({ "MEAN_DEVIATION", "ROBUST_MEAN_DEVIATION" })
        ScorerKind scorerKind;

        @Param({ "POWER", "SIMPLE_JUMPER" })
        MartingaleKind martingaleKind;

        @Param({ "FIXED", "ADAPTIVE" })
        ThresholdMode thresholdMode;

        @Param({ "SLIDING", "INDUCTIVE" })
        ReferenceMode referenceMode;

        @Param({ "250", "1000" })
        int window;

        double[][] data;
        DetectorConfig config;
        ConformalChangeDetector detector;

        @Setup(Level.Trial)
        public void setUpData() {
            NormalMixtureTestData testData = new NormalMixtureTestData();
            data = testData.generateTestData(DATA_SIZE, 1, 0L);
            config = DetectorConfig.builder().scorerKind(scorerKind).martingaleKind(martingaleKind)
                    .thresholdMode(thresholdMode).referenceMode(referenceMode).window(window).randomSeed(0L).build();
        }

        @Setup(Level.Invocation)
        public void setUpDetector() {
            detector = new ConformalChangeDetector(config);
        }
    }

    @Benchmark
    @OperationsPerInvocation(DATA_SIZE)
    public ConformalChangeDetector process(BenchmarkState state, Blackhole blackhole) {
        double[][] data = state.data;
        ConformalChangeDetector detector = state.detector;
        for (double[] point : data) {
            ChangeDescriptor result = detector.process(point);
            blackhole.consume(result.getMartingaleValue());
        }
        return detector;
    }

    @Benchmark
    @OperationsPerInvocation(DATA_SIZE)
    public SeriesAnalysis batch(BenchmarkState state) {
        return SequentialAnalysis.detectChanges(state.data, state.config);
    }
}

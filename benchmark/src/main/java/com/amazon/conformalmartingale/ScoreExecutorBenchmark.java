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
import org.openjdk.jmh.annotations.TearDown;
import org.openjdk.jmh.annotations.Warmup;

import com.amazon.conformalmartingale.config.ScorerKind;
import com.amazon.conformalmartingale.executor.IScoreExecutor;
import com.amazon.conformalmartingale.executor.ParallelScoreExecutor;
import com.amazon.conformalmartingale.executor.SequentialScoreExecutor;
import com.amazon.conformalmartingale.scoring.MahalanobisScorer;
import com.amazon.conformalmartingale.testutils.NormalMixtureTestData;

@Warmup(iterations = 5)
@Measurement(iterations = 10)
@Fork(value = 1)
@State(Scope.Thread)
public class ScoreExecutorBenchmark {

    public final static int DATA_SIZE = 5_000;

    @State(Scope.Benchmark)
    public static class BenchmarkState {
        @Param({ "1", "4", "16" })
        int dimensions;

        @Param({ "MIN_DISTANCE", "MAHALANOBIS" })
        ScorerKind scorerKind;

        @Param({ "100", "500" })
        int referenceWindow;

        @Param({ "false", "true" })
        boolean parallelExecutionEnabled;

        double[][] data;
        IScoreExecutor executor;

        @Setup(Level.Trial)
        public void setUpData() {
            NormalMixtureTestData testData = new NormalMixtureTestData();
            data = testData.generateTestData(DATA_SIZE, dimensions, 0L);
        }

        @Setup(Level.Invocation)
        public void setUpExecutor() {
            int threadPoolSize = 4;
            if (parallelExecutionEnabled) {
                executor = new ParallelScoreExecutor(scorerKind.create(MahalanobisScorer.DEFAULT_REGULARIZATION),
                        referenceWindow, threadPoolSize);
            } else {
                executor = new SequentialScoreExecutor(scorerKind.create(MahalanobisScorer.DEFAULT_REGULARIZATION),
                        referenceWindow);
            }
        }

        @TearDown(Level.Invocation)
        public void closeExecutor() {
            executor.close();
        }
    }

    @Benchmark
    @OperationsPerInvocation(DATA_SIZE)
    public double[] scoreAll(BenchmarkState state) {
        return state.executor.score(state.data);
    }
}

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

package com.amazon.conformalmartingale.executor;

import static com.amazon.conformalmartingale.CommonUtils.checkArgument;
import static com.amazon.conformalmartingale.CommonUtils.checkState;

import java.util.concurrent.ForkJoinPool;
import java.util.stream.IntStream;

import lombok.extern.slf4j.Slf4j;

import com.amazon.conformalmartingale.config.ReferenceMode;
import com.amazon.conformalmartingale.scoring.INonconformityScorer;

/**
 * An implementation of batch scoring that uses a private thread pool to score
 * indices in parallel. Each index reads the shared rows before it and writes
 * only its own slot, so no further coordination is needed; the result is
 * identical to {@link SequentialScoreExecutor}.
 */
@Slf4j
public class ParallelScoreExecutor extends AbstractScoreExecutor {

    private final ForkJoinPool forkJoinPool;
    private final int threadPoolSize;

    public ParallelScoreExecutor(INonconformityScorer scorer, int referenceWindow, int threadPoolSize) {
        this(scorer, referenceWindow, ReferenceMode.SLIDING, threadPoolSize);
    }

    public ParallelScoreExecutor(INonconformityScorer scorer, int referenceWindow, ReferenceMode referenceMode,
            int threadPoolSize) {
        super(scorer, referenceWindow, referenceMode);
        checkArgument(threadPoolSize > 0, "thread pool size must be positive");
        this.threadPoolSize = threadPoolSize;
        forkJoinPool = new ForkJoinPool(threadPoolSize);
    }

    @Override
    protected void scoreAll(double[][] series, double[] scores) {
        log.debug("scoring {} rows on {} threads", series.length, threadPoolSize);
        submitAndJoin(() -> IntStream.range(0, series.length).parallel()
                .forEach(t -> scores[t] = scoreAt(series, t)));
    }

    private void submitAndJoin(Runnable runnable) {
        checkState(!forkJoinPool.isShutdown(), "executor is closed");
        forkJoinPool.submit(runnable).join();
    }

    @Override
    public void close() {
        if (!forkJoinPool.isShutdown()) {
            log.debug("shutting down a pool of {} threads", threadPoolSize);
            forkJoinPool.shutdown();
        }
    }

    public boolean isClosed() {
        return forkJoinPool.isShutdown();
    }

    public int getThreadPoolSize() {
        return threadPoolSize;
    }
}

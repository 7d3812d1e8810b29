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
import static com.amazon.conformalmartingale.CommonUtils.checkNotNull;
import static com.amazon.conformalmartingale.CommonUtils.checkShape;

import java.util.Arrays;

import com.amazon.conformalmartingale.config.ReferenceMode;
import com.amazon.conformalmartingale.scoring.INonconformityScorer;

public abstract class AbstractScoreExecutor implements IScoreExecutor {

    protected final INonconformityScorer scorer;

    protected final int referenceWindow;

    protected final ReferenceMode referenceMode;

    protected AbstractScoreExecutor(INonconformityScorer scorer, int referenceWindow, ReferenceMode referenceMode) {
        checkArgument(referenceWindow >= 0, "reference window cannot be negative");
        this.scorer = checkNotNull(scorer, "scorer cannot be null");
        this.referenceMode = checkNotNull(referenceMode, "reference mode cannot be null");
        checkArgument(referenceMode == ReferenceMode.SLIDING
                || referenceWindow >= INonconformityScorer.MINIMUM_REFERENCE_SIZE,
                "an inductive reference set needs at least " + INonconformityScorer.MINIMUM_REFERENCE_SIZE
                        + " observations");
        this.referenceWindow = referenceWindow;
    }

    @Override
    public double[] score(double[][] series) {
        checkShape(series);
        double[] scores = new double[series.length];
        scoreAll(series, scores);
        return scores;
    }

    /**
     * fills every slot of scores; slot t is written only by the computation for
     * index t
     */
    protected abstract void scoreAll(double[][] series, double[] scores);

    /**
     * the rows before t are only read, never modified, so this is safe to call
     * concurrently for different t; the training rows of an inductive reference
     * set score 0
     */
    protected double scoreAt(double[][] series, int t) {
        if (referenceMode == ReferenceMode.INDUCTIVE) {
            if (t < referenceWindow) {
                return 0;
            }
            return scorer.score(series[t], Arrays.copyOfRange(series, 0, referenceWindow));
        }
        int start = (referenceWindow == 0) ? 0 : Math.max(0, t - referenceWindow);
        return scorer.score(series[t], Arrays.copyOfRange(series, start, t));
    }

    @Override
    public int getReferenceWindow() {
        return referenceWindow;
    }

    public ReferenceMode getReferenceMode() {
        return referenceMode;
    }

    public INonconformityScorer getScorer() {
        return scorer;
    }
}

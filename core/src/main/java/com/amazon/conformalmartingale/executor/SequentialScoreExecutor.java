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

import com.amazon.conformalmartingale.config.ReferenceMode;
import com.amazon.conformalmartingale.scoring.INonconformityScorer;

/**
 * Scores the indices one after another in the calling thread.
 */
public class SequentialScoreExecutor extends AbstractScoreExecutor {

    public SequentialScoreExecutor(INonconformityScorer scorer, int referenceWindow) {
        this(scorer, referenceWindow, ReferenceMode.SLIDING);
    }

    public SequentialScoreExecutor(INonconformityScorer scorer, int referenceWindow, ReferenceMode referenceMode) {
        super(scorer, referenceWindow, referenceMode);
    }

    @Override
    protected void scoreAll(double[][] series, double[] scores) {
        for (int t = 0; t < series.length; t++) {
            scores[t] = scoreAt(series, t);
        }
    }
}

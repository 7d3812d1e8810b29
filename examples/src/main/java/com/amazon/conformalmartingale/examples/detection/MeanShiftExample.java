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
import java.util.Random;

import com.amazon.conformalmartingale.config.MartingaleKind;
import com.amazon.conformalmartingale.config.ScorerKind;
import com.amazon.conformalmartingale.examples.Example;
import com.amazon.conformalmartingale.services.ConformalChangeDetector;
import com.amazon.conformalmartingale.services.SequentialAnalysis;
import com.amazon.conformalmartingale.services.config.DetectorConfig;
import com.amazon.conformalmartingale.services.config.ThresholdMode;
import com.amazon.conformalmartingale.services.returntypes.ChangeDescriptor;
import com.amazon.conformalmartingale.services.returntypes.SeriesAnalysis;
import com.amazon.conformalmartingale.testutils.LevelShiftTestData;

/**
 * Streams a univariate series with a single level shift through a detector and
 * prints every confirmed change, then replays the same series in batch.
 */
public class MeanShiftExample implements Example {

    public static void main(String[] args) throws Exception {
        new MeanShiftExample().run();
    }

    @Override
    public String command() {
        return "mean_shift";
    }

    @Override
    public String description() {
        return "detect a level shift in a univariate stream";
    }

    @Override
    public void run() throws Exception {
        int before = 300;
        int after = 200;
        double shift = 3.0;
        double sigma = 1.0;

        long seed = new Random().nextLong();
        System.out.println("seed = " + seed);
        double[] series = LevelShiftTestData.univariate(before, after, shift, sigma, seed);

        DetectorConfig config = DetectorConfig.builder()
                // the median based score is less sensitive to the shifted points that
                // have already entered the reference
                .scorerKind(ScorerKind.ROBUST_MEAN_DEVIATION).martingaleKind(MartingaleKind.POWER)
                // 1/alpha is the smallest value of the martingale that counts as a change
                .alpha(0.01)
                // a martingale that keeps climbing after a change raises the bar
                .thresholdMode(ThresholdMode.ADAPTIVE).thresholdWindow(30)
                // three points in a row above the threshold confirm a change
                .minConsecutive(3).randomSeed(seed).build();

        ConformalChangeDetector detector = new ConformalChangeDetector(config);
        for (double value : series) {
            ChangeDescriptor result = detector.process(value);
            if (result.isConfirmedNow()) {
                long start = result.getIndex() + result.getRelativeIndexOfRunStart();
                System.out.printf("change confirmed at %d, started at %d (true change at %d), martingale %.2f%n",
                        result.getIndex(), start, before, result.getMartingaleValue());
            }
        }

        SeriesAnalysis analysis = SequentialAnalysis.detectChanges(series, config);
        System.out.println("change points from batch replay " + Arrays.toString(analysis.getChangePoints()));
        System.out.printf("largest martingale value %.2f%n", Arrays.stream(analysis.getMartingale()).max()
                .orElse(0));
    }
}

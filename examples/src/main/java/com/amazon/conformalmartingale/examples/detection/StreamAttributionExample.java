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
import java.util.Map;

import com.amazon.conformalmartingale.config.MartingaleKind;
import com.amazon.conformalmartingale.config.ScorerKind;
import com.amazon.conformalmartingale.examples.Example;
import com.amazon.conformalmartingale.services.SequentialAnalysis;
import com.amazon.conformalmartingale.services.attribution.Attribution;
import com.amazon.conformalmartingale.services.attribution.FeatureContribution;
import com.amazon.conformalmartingale.services.config.DetectorConfig;
import com.amazon.conformalmartingale.services.returntypes.MultivariateAnalysis;
import com.amazon.conformalmartingale.services.returntypes.SeriesAnalysis;
import com.amazon.conformalmartingale.testutils.LevelShiftTestData;
import com.amazon.conformalmartingale.testutils.MultiDimDataWithKey;

/**
 * Several metrics of a service, where only some of them shift. Every metric is
 * analyzed on its own, the joint vector with a Mahalanobis score, and each joint
 * change is attributed to the metrics that moved.
 */
public class StreamAttributionExample implements Example {

    public static void main(String[] args) throws Exception {
        new StreamAttributionExample().run();
    }

    @Override
    public String command() {
        return "stream_attribution";
    }

    @Override
    public String description() {
        return "analyze several streams jointly and attribute the changes";
    }

    @Override
    public void run() throws Exception {
        String[] names = new String[] { "latency", "errors", "throughput", "cpu" };
        double[] shift = new double[] { 2.5, 0, 0, 4.0 };
        MultiDimDataWithKey data = LevelShiftTestData.generate(400, 200, shift, 1.0, 0L);

        DetectorConfig univariate = DetectorConfig.builder().scorerKind(ScorerKind.ROBUST_MEAN_DEVIATION)
                .randomSeed(0L).build();
        DetectorConfig multivariate = DetectorConfig.builder().dimensions(names.length)
                .scorerKind(ScorerKind.MAHALANOBIS).martingaleKind(MartingaleKind.SIMPLE_JUMPER)
                .attributionBefore(100).attributionAfter(20).parallelExecutionEnabled(true).randomSeed(0L).build();

        MultivariateAnalysis analysis = SequentialAnalysis.analyzeStreams(data.data, names, univariate,
                multivariate);

        System.out.println("true change at " + Arrays.toString(data.changeIndices));
        for (Map.Entry<String, SeriesAnalysis> entry : analysis.getStreams().entrySet()) {
            System.out.printf("%-10s change points %s%n", entry.getKey(),
                    Arrays.toString(entry.getValue().getChangePoints()));
        }
        System.out.printf("%-10s change points %s%n", "joint", Arrays.toString(analysis.getJoint().getChangePoints()));

        for (Attribution attribution : analysis.getAttributions()) {
            System.out.println("change at " + attribution.getChangeIndex());
            for (FeatureContribution contribution : attribution.getContributions()) {
                System.out.printf("\t%-10s mean shift %.2f, spread shift %.2f%n", contribution.getName(),
                        contribution.getMeanShift(), contribution.getSpreadShift());
            }
        }
    }
}

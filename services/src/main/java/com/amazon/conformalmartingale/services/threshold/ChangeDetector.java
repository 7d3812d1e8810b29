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

package com.amazon.conformalmartingale.services.threshold;

import static com.amazon.conformalmartingale.CommonUtils.checkArgument;
import static com.amazon.conformalmartingale.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

import com.amazon.conformalmartingale.services.config.DetectorConfig;
import com.amazon.conformalmartingale.services.returntypes.DetectionEvent;
import com.amazon.conformalmartingale.services.returntypes.DetectionResult;

/**
 * Turns a martingale sequence into detections: every value is compared with a
 * threshold that depends on the values before it, and the crossings go through
 * a {@link PersistenceFilter}. Non-finite values never cross and never enter
 * the history of an adaptive threshold.
 */
public class ChangeDetector {

    private final Supplier<IThreshold> thresholdSupplier;

    private final int minConsecutive;

    public ChangeDetector(Supplier<IThreshold> thresholdSupplier, int minConsecutive) {
        checkArgument(minConsecutive > 0, "min consecutive must be positive");
        this.thresholdSupplier = checkNotNull(thresholdSupplier, "threshold cannot be null");
        this.minConsecutive = minConsecutive;
    }

    public ChangeDetector(DetectorConfig config) {
        this(config::createThreshold, config.getMinConsecutive());
    }

    /**
     * @param martingale the martingale values
     * @return thresholds, crossings, detections and events
     */
    public DetectionResult detect(double[] martingale) {
        checkNotNull(martingale, "martingale cannot be null");
        IThreshold threshold = thresholdSupplier.get();
        PersistenceFilter filter = new PersistenceFilter(minConsecutive);
        double[] thresholds = new double[martingale.length];
        boolean[] crossings = new boolean[martingale.length];
        boolean[] detections = new boolean[martingale.length];
        for (int t = 0; t < martingale.length; t++) {
            thresholds[t] = threshold.getThreshold();
            crossings[t] = threshold.isCrossing(martingale[t]);
            threshold.update(martingale[t]);
            int marked = filter.accept(crossings[t]);
            for (int j = t - marked + 1; j <= t; j++) {
                detections[j] = true;
            }
        }
        List<DetectionEvent> events = new ArrayList<>();
        for (int t = 0; t < martingale.length; t++) {
            if (crossings[t]) {
                events.add(new DetectionEvent(t, detections[t]));
            }
        }
        return new DetectionResult(thresholds, crossings, detections, events);
    }

    /**
     * adaptive detection at the default significance level
     *
     * @param martingale          the martingale values
     * @param window              number of earlier values behind the adaptive
     *                            threshold
     * @param thresholdMultiplier multiplier of the percentile
     * @param minConsecutive      required length of a run of crossings
     * @return the detections
     */
    public static DetectionResult detect(double[] martingale, int window, double thresholdMultiplier,
            int minConsecutive) {
        return new ChangeDetector(() -> new AdaptiveThreshold(DetectorConfig.DEFAULT_ALPHA, window,
                thresholdMultiplier, DetectorConfig.DEFAULT_THRESHOLD_PERCENTILE), minConsecutive).detect(martingale);
    }

    public int getMinConsecutive() {
        return minConsecutive;
    }
}

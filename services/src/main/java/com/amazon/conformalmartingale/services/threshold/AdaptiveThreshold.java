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

import java.util.Arrays;

import org.apache.commons.math3.stat.descriptive.rank.Percentile;

/**
 * max(1/alpha, multiplier * percentile of the last window finite martingale
 * values). The percentile uses linear interpolation between order statistics.
 * A martingale that drifts upward for reasons other than a change (a noisy
 * wealth process) raises the bar along with it, while 1/alpha remains the
 * floor.
 */
public class AdaptiveThreshold implements IThreshold {

    private final double alpha;

    private final int window;

    private final double multiplier;

    private final double percentile;

    private final Percentile estimator;

    // ring buffer of the last window finite values
    private final double[] values;

    private int size;

    private int next;

    public AdaptiveThreshold(double alpha, int window, double multiplier, double percentile) {
        checkArgument(alpha > 0 && alpha < 1, "alpha must be in (0, 1)");
        checkArgument(window > 0, "window must be positive");
        checkArgument(multiplier > 0 && Double.isFinite(multiplier), "multiplier must be positive");
        checkArgument(percentile > 0 && percentile <= 100, "percentile must be in (0, 100]");
        this.alpha = alpha;
        this.window = window;
        this.multiplier = multiplier;
        this.percentile = percentile;
        this.estimator = new Percentile(percentile).withEstimationType(Percentile.EstimationType.R_7);
        this.values = new double[window];
        this.size = 0;
        this.next = 0;
    }

    /**
     * a threshold that already saw the given values, oldest first
     */
    public AdaptiveThreshold(double alpha, int window, double multiplier, double percentile, double[] recent) {
        this(alpha, window, multiplier, percentile);
        checkNotNull(recent, "values cannot be null");
        for (double value : recent) {
            update(value);
        }
    }

    @Override
    public double getThreshold() {
        double floor = 1.0 / alpha;
        if (size == 0) {
            return floor;
        }
        return Math.max(floor, multiplier * estimator.evaluate(values, 0, size));
    }

    @Override
    public void update(double martingaleValue) {
        if (!Double.isFinite(martingaleValue)) {
            return;
        }
        values[next] = martingaleValue;
        next = (next + 1) % window;
        if (size < window) {
            ++size;
        }
    }

    /**
     * @return the values in the window, oldest first
     */
    public double[] getRecentValues() {
        double[] answer = new double[size];
        int start = (size < window) ? 0 : next;
        for (int i = 0; i < size; i++) {
            answer[i] = values[(start + i) % window];
        }
        return answer;
    }

    public double getAlpha() {
        return alpha;
    }

    public int getWindow() {
        return window;
    }

    public double getMultiplier() {
        return multiplier;
    }

    public double getPercentile() {
        return percentile;
    }

    @Override
    public String toString() {
        return "AdaptiveThreshold" + Arrays.toString(getRecentValues());
    }
}

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

package com.amazon.conformalmartingale.services.attribution;

import static com.amazon.conformalmartingale.CommonUtils.checkArgument;
import static com.amazon.conformalmartingale.CommonUtils.checkNotNull;
import static com.amazon.conformalmartingale.CommonUtils.checkShape;
import static com.amazon.conformalmartingale.CommonUtils.getColumn;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

import com.amazon.conformalmartingale.scoring.INonconformityScorer;
import com.amazon.conformalmartingale.statistics.Deviation;

/**
 * Compares the rows [c - before, c) with the rows [c, c + after) around a change
 * point c, feature by feature, and ranks the features by the shift of their
 * mean and standard deviation. Both windows are truncated at the ends of the
 * data. With fewer than two rows before or no row after, every contribution is
 * 0.
 */
public class ShiftAttributor {

    private final int before;

    private final int after;

    public ShiftAttributor(int before, int after) {
        checkArgument(before > 0, "before window must be positive");
        checkArgument(after > 0, "after window must be positive");
        this.before = before;
        this.after = after;
    }

    /**
     * @param data        rows are time, columns are features; not modified
     * @param changeIndex the change point
     * @param names       feature names, or null for "feature_j"
     * @return the ranked contributions
     */
    public Attribution attribute(double[][] data, int changeIndex, String[] names) {
        int dimensions = checkShape(data);
        checkArgument(changeIndex >= 0 && changeIndex <= data.length, "change index out of range");
        checkArgument(names == null || names.length == dimensions, "one name per feature is required");
        int start = Math.max(0, changeIndex - before);
        int end = Math.min(data.length, changeIndex + after);
        boolean enoughData = changeIndex - start >= 2 && end > changeIndex;

        List<FeatureContribution> contributions = new ArrayList<>();
        for (int j = 0; j < dimensions; j++) {
            String name = (names == null) ? "feature_" + j : checkNotNull(names[j], "names cannot be null");
            if (!enoughData) {
                contributions.add(new FeatureContribution(name, j, 0, 0));
                continue;
            }
            double[] column = getColumn(data, j);
            Deviation previous = Deviation.of(Arrays.copyOfRange(column, start, changeIndex));
            Deviation next = Deviation.of(Arrays.copyOfRange(column, changeIndex, end));
            double scale = previous.getDeviation() + INonconformityScorer.STABILITY_EPSILON;
            contributions.add(new FeatureContribution(name, j, Math.abs(next.getMean() - previous.getMean()) / scale,
                    Math.abs(next.getDeviation() - previous.getDeviation()) / scale));
        }
        // stable sort, ties keep the column order
        contributions.sort(Comparator.comparingDouble(FeatureContribution::getTotalShift).reversed());
        return new Attribution(changeIndex, contributions);
    }

    public Attribution attribute(double[][] data, int changeIndex) {
        return attribute(data, changeIndex, null);
    }

    public int getBefore() {
        return before;
    }

    public int getAfter() {
        return after;
    }
}

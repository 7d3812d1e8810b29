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

package com.amazon.conformalmartingale.pvalue;

import static com.amazon.conformalmartingale.CommonUtils.checkArgument;

/**
 * Decides when two scores are treated as equal: |a - b| <= absolute + relative
 * * |b|. Scores of continuous data rarely tie exactly, but floating point noise
 * in repeated or quantized observations would otherwise be read as a strict
 * ordering.
 */
public class TieTolerance {

    public static final double DEFAULT_RELATIVE_TOLERANCE = 1e-5;

    public static final double DEFAULT_ABSOLUTE_TOLERANCE = 1e-8;

    public static final TieTolerance DEFAULT = new TieTolerance(DEFAULT_RELATIVE_TOLERANCE,
            DEFAULT_ABSOLUTE_TOLERANCE);

    private final double relativeTolerance;

    private final double absoluteTolerance;

    public TieTolerance(double relativeTolerance, double absoluteTolerance) {
        checkArgument(relativeTolerance >= 0 && Double.isFinite(relativeTolerance),
                "relative tolerance cannot be negative");
        checkArgument(absoluteTolerance >= 0 && Double.isFinite(absoluteTolerance),
                "absolute tolerance cannot be negative");
        this.relativeTolerance = relativeTolerance;
        this.absoluteTolerance = absoluteTolerance;
    }

    /**
     * @param a    a score from the window
     * @param b    the score being ranked
     * @return true if a is considered equal to b
     */
    public boolean isClose(double a, double b) {
        return Math.abs(a - b) <= absoluteTolerance + relativeTolerance * Math.abs(b);
    }

    public double getRelativeTolerance() {
        return relativeTolerance;
    }

    public double getAbsoluteTolerance() {
        return absoluteTolerance;
    }
}

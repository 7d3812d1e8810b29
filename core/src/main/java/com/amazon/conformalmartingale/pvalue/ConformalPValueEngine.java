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
import static com.amazon.conformalmartingale.CommonUtils.checkNotNull;

import java.util.Arrays;

import com.amazon.conformalmartingale.util.UniformSequence;

/**
 * Streaming computation of conformal p-values. Every score is ranked against
 * the window of the last calibrationWindow scores before it together with
 * itself; a calibration window of 0 uses the whole history. Only the scores
 * that a future window can reach are retained.
 *
 * The tie breaking draw of the n-th score is the n-th value of a
 * {@link UniformSequence}, so an engine restored from its state, or the batch
 * form in {@link ConformalPValues}, produces identical p-values.
 */
public class ConformalPValueEngine {

    private static final int INITIAL_CAPACITY = 16;

    private final int calibrationWindow;

    private final TieTolerance tolerance;

    private final UniformSequence uniforms;

    private double[] buffer;

    private int size;

    private long index;

    public ConformalPValueEngine(int calibrationWindow, TieTolerance tolerance, long seed) {
        checkArgument(calibrationWindow >= 0, "calibration window cannot be negative");
        this.calibrationWindow = calibrationWindow;
        this.tolerance = checkNotNull(tolerance, "tolerance cannot be null");
        this.uniforms = new UniformSequence(seed);
        this.buffer = new double[(calibrationWindow > 0) ? 2 * (calibrationWindow + 1) : INITIAL_CAPACITY];
        this.size = 0;
        this.index = 0;
    }

    /**
     * an engine that continues after index scores, of which the retained ones are
     * given in history (oldest first)
     */
    public ConformalPValueEngine(int calibrationWindow, TieTolerance tolerance, long seed, long index,
            double[] history) {
        this(calibrationWindow, tolerance, seed);
        checkNotNull(history, "history cannot be null");
        checkArgument(index >= history.length, "index cannot be smaller than the retained history");
        int start = (calibrationWindow > 0) ? Math.max(0, history.length - calibrationWindow) : 0;
        for (int i = start; i < history.length; i++) {
            append(history[i]);
        }
        this.index = index;
    }

    /**
     * adds a score to the history and ranks it
     *
     * @param score a finite score
     * @return the p-values of the score
     */
    public ConformalPValue process(double score) {
        checkArgument(Double.isFinite(score), "scores have to be finite");
        append(score);
        int start = (calibrationWindow > 0) ? Math.max(0, size - calibrationWindow - 1) : 0;
        ConformalPValue answer = ConformalPValue.evaluate(buffer, start, size, uniforms.get(index), tolerance);
        ++index;
        return answer;
    }

    private void append(double score) {
        if (size == buffer.length) {
            if (calibrationWindow > 0 && size > calibrationWindow) {
                System.arraycopy(buffer, size - calibrationWindow, buffer, 0, calibrationWindow);
                size = calibrationWindow;
            } else {
                buffer = Arrays.copyOf(buffer, 2 * buffer.length);
            }
        }
        buffer[size++] = score;
    }

    /**
     * @return the scores a future window can still reach, oldest first
     */
    public double[] getRetainedScores() {
        int start = (calibrationWindow > 0) ? Math.max(0, size - calibrationWindow) : 0;
        return Arrays.copyOfRange(buffer, start, size);
    }

    /**
     * @return the number of scores processed so far
     */
    public long getIndex() {
        return index;
    }

    public int getCalibrationWindow() {
        return calibrationWindow;
    }

    public TieTolerance getTolerance() {
        return tolerance;
    }

    public long getSeed() {
        return uniforms.getSeed();
    }
}

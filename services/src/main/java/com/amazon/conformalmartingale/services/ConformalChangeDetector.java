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

package com.amazon.conformalmartingale.services;

import static com.amazon.conformalmartingale.CommonUtils.checkArgument;
import static com.amazon.conformalmartingale.CommonUtils.checkFinite;
import static com.amazon.conformalmartingale.CommonUtils.checkNotNull;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.List;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import com.amazon.conformalmartingale.config.ReferenceMode;
import com.amazon.conformalmartingale.martingale.IMartingale;
import com.amazon.conformalmartingale.pvalue.ConformalPValue;
import com.amazon.conformalmartingale.pvalue.ConformalPValueEngine;
import com.amazon.conformalmartingale.scoring.INonconformityScorer;
import com.amazon.conformalmartingale.services.calibration.CalibrationSnapshot;
import com.amazon.conformalmartingale.services.config.DetectorConfig;
import com.amazon.conformalmartingale.services.returntypes.ChangeDescriptor;
import com.amazon.conformalmartingale.services.threshold.IThreshold;
import com.amazon.conformalmartingale.services.threshold.PersistenceFilter;

/**
 * Streaming change detection, one observation at a time: the observation is
 * scored against the reference set, the score is turned into conformal
 * p-values, the chosen p-value drives the martingale and the martingale value
 * is thresholded and filtered for persistence. The reference set and the score
 * history are append-only (bounded by the windows when configured). An
 * inductive reference set is filled by the first observations, which only
 * advance the threshold and the persistence filter, and is frozen afterwards.
 *
 * A detector has a single writer; it is not safe to call
 * {@link #process(double[])} from several threads. For the same configuration
 * the outputs equal those of {@link SequentialAnalysis}.
 */
@Slf4j
@Getter
public class ConformalChangeDetector {

    private final DetectorConfig config;

    private final INonconformityScorer scorer;

    private final ConformalPValueEngine pValueEngine;

    private final IMartingale martingale;

    private final IThreshold threshold;

    private final PersistenceFilter persistenceFilter;

    // the reference set, oldest first
    @Getter(AccessLevel.NONE)
    private final ArrayDeque<double[]> history;

    /**
     * number of observations processed, calibration data excluded
     */
    private long index;

    public ConformalChangeDetector(DetectorConfig config) {
        this(config, null);
    }

    /**
     * a detector that treats the snapshot as data it has already seen
     *
     * @param config   the configuration
     * @param snapshot calibration data scored with the same configuration, may be
     *                 null
     */
    public ConformalChangeDetector(DetectorConfig config, CalibrationSnapshot snapshot) {
        checkNotNull(config, "config cannot be null");
        this.config = config;
        this.scorer = config.createScorer();
        this.martingale = config.createMartingale();
        this.threshold = config.createThreshold();
        this.persistenceFilter = config.createPersistenceFilter();
        this.history = new ArrayDeque<>();
        this.index = 0;
        if (snapshot == null) {
            this.pValueEngine = new ConformalPValueEngine(config.getCalibrationWindow(), config.getTieTolerance(),
                    config.getRandomSeed());
        } else {
            checkArgument(snapshot.getDimensions() == config.getDimensions(),
                    "calibration data does not match the dimensions");
            for (double[] point : snapshot.getObservations()) {
                appendToHistory(point);
            }
            // the scores of training observations are not calibration scores
            int trained = Math.min(config.getTrainingLength(), snapshot.size());
            double[] scores = snapshot.getScores();
            this.pValueEngine = new ConformalPValueEngine(config.getCalibrationWindow(), config.getTieTolerance(),
                    config.getRandomSeed(), snapshot.size() - trained,
                    Arrays.copyOfRange(scores, trained, scores.length));
        }
        log.debug("created detector with {}", config);
    }

    /**
     * restores a detector from its parts
     */
    public ConformalChangeDetector(DetectorConfig config, List<double[]> history, ConformalPValueEngine pValueEngine,
            IMartingale martingale, IThreshold threshold, PersistenceFilter persistenceFilter, long index) {
        this.config = checkNotNull(config, "config cannot be null");
        this.scorer = config.createScorer();
        this.pValueEngine = checkNotNull(pValueEngine, "p-value engine cannot be null");
        this.martingale = checkNotNull(martingale, "martingale cannot be null");
        this.threshold = checkNotNull(threshold, "threshold cannot be null");
        this.persistenceFilter = checkNotNull(persistenceFilter, "persistence filter cannot be null");
        checkArgument(index >= 0, "index cannot be negative");
        this.index = index;
        this.history = new ArrayDeque<>();
        for (double[] point : checkNotNull(history, "history cannot be null")) {
            checkArgument(point.length == config.getDimensions(), "history does not match the dimensions");
            appendToHistory(Arrays.copyOf(point, point.length));
        }
    }

    /**
     * processes the next observation
     *
     * @param point the observation, of length dimensions
     * @return the score, p-values, martingale value and detection status
     */
    public ChangeDescriptor process(double[] point) {
        checkNotNull(point, "point cannot be null");
        checkArgument(point.length == config.getDimensions(),
                "point has length " + point.length + ", expected " + config.getDimensions());
        checkFinite(point);
        double[] copy = Arrays.copyOf(point, point.length);
        ChangeDescriptor descriptor = new ChangeDescriptor(index, copy);

        double score;
        ConformalPValue pValue;
        double value;
        if (history.size() < config.getTrainingLength()) {
            // builds the reference set without evidence for or against a change
            score = 0;
            appendToHistory(copy);
            pValue = new ConformalPValue(1.0, 1.0);
            value = martingale.getValue();
        } else {
            score = scorer.score(copy, history.toArray(new double[0][]));
            appendToHistory(copy);
            pValue = pValueEngine.process(score);
            value = martingale.update(pValue.get(config.isUseRandomizedPValue()));
        }
        double bound = threshold.getThreshold();
        boolean crossing = threshold.isCrossing(value);
        threshold.update(value);
        int newlyDetected = persistenceFilter.accept(crossing);

        descriptor.setScore(score);
        descriptor.setPValue(pValue.getDeterministic());
        descriptor.setRandomizedPValue(pValue.getRandomized());
        descriptor.setMartingaleValue(value);
        descriptor.setThreshold(bound);
        descriptor.setCrossing(crossing);
        descriptor.setDetectionState(persistenceFilter.getState());
        descriptor.setNewlyDetected(newlyDetected);
        descriptor.setRelativeIndexOfRunStart(1 - Math.max(1, persistenceFilter.getCount()));
        if (descriptor.isConfirmedNow()) {
            log.debug("change confirmed at index {}, run started at {}, martingale {} above {}", index,
                    index + descriptor.getRelativeIndexOfRunStart(), value, bound);
        }
        ++index;
        return descriptor;
    }

    /**
     * univariate convenience form of {@link #process(double[])}
     */
    public ChangeDescriptor process(double value) {
        return process(new double[] { value });
    }

    private void appendToHistory(double[] point) {
        int window = config.getReferenceWindow();
        if (config.getReferenceMode() == ReferenceMode.INDUCTIVE) {
            // frozen once complete
            if (history.size() < window) {
                history.addLast(point);
            }
            return;
        }
        history.addLast(point);
        if (window > 0 && history.size() > window) {
            history.pollFirst();
        }
    }

    /**
     * @return a copy of the reference set, oldest first
     */
    public double[][] getReferenceSet() {
        double[][] answer = new double[history.size()][];
        int i = 0;
        for (double[] point : history) {
            answer[i++] = Arrays.copyOf(point, point.length);
        }
        return answer;
    }
}

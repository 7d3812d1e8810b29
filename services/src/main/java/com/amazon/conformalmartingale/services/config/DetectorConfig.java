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

package com.amazon.conformalmartingale.services.config;

import static com.amazon.conformalmartingale.CommonUtils.checkArgument;
import static com.amazon.conformalmartingale.CommonUtils.checkNotNull;

import java.util.Optional;
import java.util.Random;

import lombok.Getter;
import lombok.ToString;

import com.amazon.conformalmartingale.config.MartingaleKind;
import com.amazon.conformalmartingale.config.ReferenceMode;
import com.amazon.conformalmartingale.config.ScorerKind;
import com.amazon.conformalmartingale.executor.IScoreExecutor;
import com.amazon.conformalmartingale.executor.ParallelScoreExecutor;
import com.amazon.conformalmartingale.executor.SequentialScoreExecutor;
import com.amazon.conformalmartingale.martingale.IMartingale;
import com.amazon.conformalmartingale.martingale.PowerMartingale;
import com.amazon.conformalmartingale.martingale.SimpleJumperMartingale;
import com.amazon.conformalmartingale.pvalue.TieTolerance;
import com.amazon.conformalmartingale.scoring.INonconformityScorer;
import com.amazon.conformalmartingale.scoring.MahalanobisScorer;
import com.amazon.conformalmartingale.services.threshold.AdaptiveThreshold;
import com.amazon.conformalmartingale.services.threshold.FixedThreshold;
import com.amazon.conformalmartingale.services.threshold.IThreshold;
import com.amazon.conformalmartingale.services.threshold.PersistenceFilter;

/**
 * The complete configuration of a change detection pipeline. Instances are
 * immutable and validated when built; the named kinds are resolved into
 * strategy objects through the factory methods, once per pipeline.
 */
@Getter
@ToString
public class DetectorConfig {

    public static final int DEFAULT_DIMENSIONS = 1;

    public static final ScorerKind DEFAULT_SCORER_KIND = ScorerKind.MEAN_DEVIATION;

    public static final MartingaleKind DEFAULT_MARTINGALE_KIND = MartingaleKind.POWER;

    public static final double DEFAULT_EPSILON = PowerMartingale.DEFAULT_EPSILON;

    public static final double DEFAULT_JUMP_PROBABILITY = SimpleJumperMartingale.DEFAULT_JUMP_PROBABILITY;

    public static final double DEFAULT_ALPHA = 0.05;

    public static final ReferenceMode DEFAULT_REFERENCE_MODE = ReferenceMode.INDUCTIVE;

    public static final int DEFAULT_REFERENCE_WINDOW = 30;

    public static final int DEFAULT_CALIBRATION_WINDOW = 0;

    public static final ThresholdMode DEFAULT_THRESHOLD_MODE = ThresholdMode.FIXED;

    public static final int DEFAULT_THRESHOLD_WINDOW = 30;

    public static final double DEFAULT_THRESHOLD_MULTIPLIER = 1.0;

    public static final double DEFAULT_THRESHOLD_PERCENTILE = 95.0;

    public static final int DEFAULT_MIN_CONSECUTIVE = 3;

    public static final double DEFAULT_REGULARIZATION = MahalanobisScorer.DEFAULT_REGULARIZATION;

    public static final boolean DEFAULT_USE_RANDOMIZED_P_VALUE = true;

    public static final boolean DEFAULT_PARALLEL_EXECUTION_ENABLED = false;

    public static final int DEFAULT_ATTRIBUTION_BEFORE = 30;

    public static final int DEFAULT_ATTRIBUTION_AFTER = 10;

    private final int dimensions;

    private final ScorerKind scorerKind;

    private final MartingaleKind martingaleKind;

    /**
     * sensitivity of the power martingale
     */
    private final double epsilon;

    /**
     * switching probability of the simple jumper martingale
     */
    private final double jumpProbability;

    /**
     * significance level; the fixed threshold is 1/alpha
     */
    private final double alpha;

    private final ReferenceMode referenceMode;

    /**
     * size of the reference set a new observation is scored against; for a
     * sliding reference 0 means all earlier observations
     */
    private final int referenceWindow;

    /**
     * number of earlier scores a new score is ranked against, 0 for all
     */
    private final int calibrationWindow;

    private final ThresholdMode thresholdMode;

    /**
     * number of earlier martingale values the adaptive threshold looks at
     */
    private final int thresholdWindow;

    private final double thresholdMultiplier;

    private final double thresholdPercentile;

    private final int minConsecutive;

    private final double relativeTolerance;

    private final double absoluteTolerance;

    private final double regularization;

    private final boolean useRandomizedPValue;

    private final long randomSeed;

    private final boolean parallelExecutionEnabled;

    private final int threadPoolSize;

    private final int attributionBefore;

    private final int attributionAfter;

    protected DetectorConfig(Builder<?> builder) {
        dimensions = builder.dimensions;
        scorerKind = builder.scorerKind;
        martingaleKind = builder.martingaleKind;
        epsilon = builder.epsilon;
        jumpProbability = builder.jumpProbability;
        alpha = builder.alpha;
        referenceMode = builder.referenceMode;
        referenceWindow = builder.referenceWindow;
        calibrationWindow = builder.calibrationWindow;
        thresholdMode = builder.thresholdMode;
        thresholdWindow = builder.thresholdWindow;
        thresholdMultiplier = builder.thresholdMultiplier;
        thresholdPercentile = builder.thresholdPercentile;
        minConsecutive = builder.minConsecutive;
        relativeTolerance = builder.relativeTolerance;
        absoluteTolerance = builder.absoluteTolerance;
        regularization = builder.regularization;
        useRandomizedPValue = builder.useRandomizedPValue;
        randomSeed = builder.randomSeed.orElseGet(() -> new Random().nextLong());
        parallelExecutionEnabled = builder.parallelExecutionEnabled;
        threadPoolSize = builder.threadPoolSize.orElse(Runtime.getRuntime().availableProcessors());
        attributionBefore = builder.attributionBefore;
        attributionAfter = builder.attributionAfter;
    }

    public static Builder<?> builder() {
        return new Builder<>();
    }

    /**
     * @return a builder holding this configuration, including the resolved
     *         random seed
     */
    public Builder<?> toBuilder() {
        return new Builder<>().dimensions(dimensions).scorerKind(scorerKind).martingaleKind(martingaleKind)
                .epsilon(epsilon).jumpProbability(jumpProbability).alpha(alpha).referenceMode(referenceMode)
                .referenceWindow(referenceWindow)
                .calibrationWindow(calibrationWindow).thresholdMode(thresholdMode).thresholdWindow(thresholdWindow)
                .thresholdMultiplier(thresholdMultiplier).thresholdPercentile(thresholdPercentile)
                .minConsecutive(minConsecutive).relativeTolerance(relativeTolerance)
                .absoluteTolerance(absoluteTolerance).regularization(regularization)
                .useRandomizedPValue(useRandomizedPValue).randomSeed(randomSeed)
                .parallelExecutionEnabled(parallelExecutionEnabled).threadPoolSize(threadPoolSize)
                .attributionBefore(attributionBefore).attributionAfter(attributionAfter);
    }

    /**
     * @return the Ville threshold 1/alpha
     */
    public double getFixedThreshold() {
        return 1.0 / alpha;
    }

    /**
     * @return the number of leading observations that only build an inductive
     *         reference set, 0 for a sliding one
     */
    public int getTrainingLength() {
        return referenceMode.getTrainingLength(referenceWindow);
    }

    public INonconformityScorer createScorer() {
        return scorerKind.create(regularization);
    }

    public IScoreExecutor createScoreExecutor() {
        if (parallelExecutionEnabled) {
            return new ParallelScoreExecutor(createScorer(), referenceWindow, referenceMode, threadPoolSize);
        }
        return new SequentialScoreExecutor(createScorer(), referenceWindow, referenceMode);
    }

    public IMartingale createMartingale() {
        return martingaleKind.create(epsilon, jumpProbability);
    }

    public TieTolerance getTieTolerance() {
        return new TieTolerance(relativeTolerance, absoluteTolerance);
    }

    public IThreshold createThreshold() {
        if (thresholdMode == ThresholdMode.FIXED) {
            return new FixedThreshold(alpha);
        }
        return new AdaptiveThreshold(alpha, thresholdWindow, thresholdMultiplier, thresholdPercentile);
    }

    public PersistenceFilter createPersistenceFilter() {
        return new PersistenceFilter(minConsecutive);
    }

    public static class Builder<T extends Builder<T>> {

        // Optional is used where the default is not a constant
        protected int dimensions = DEFAULT_DIMENSIONS;
        protected ScorerKind scorerKind = DEFAULT_SCORER_KIND;
        protected MartingaleKind martingaleKind = DEFAULT_MARTINGALE_KIND;
        protected double epsilon = DEFAULT_EPSILON;
        protected double jumpProbability = DEFAULT_JUMP_PROBABILITY;
        protected double alpha = DEFAULT_ALPHA;
        protected ReferenceMode referenceMode = DEFAULT_REFERENCE_MODE;
        protected int referenceWindow = DEFAULT_REFERENCE_WINDOW;
        protected int calibrationWindow = DEFAULT_CALIBRATION_WINDOW;
        protected ThresholdMode thresholdMode = DEFAULT_THRESHOLD_MODE;
        protected int thresholdWindow = DEFAULT_THRESHOLD_WINDOW;
        protected double thresholdMultiplier = DEFAULT_THRESHOLD_MULTIPLIER;
        protected double thresholdPercentile = DEFAULT_THRESHOLD_PERCENTILE;
        protected int minConsecutive = DEFAULT_MIN_CONSECUTIVE;
        protected double relativeTolerance = TieTolerance.DEFAULT_RELATIVE_TOLERANCE;
        protected double absoluteTolerance = TieTolerance.DEFAULT_ABSOLUTE_TOLERANCE;
        protected double regularization = DEFAULT_REGULARIZATION;
        protected boolean useRandomizedPValue = DEFAULT_USE_RANDOMIZED_P_VALUE;
        protected Optional<Long> randomSeed = Optional.empty();
        protected boolean parallelExecutionEnabled = DEFAULT_PARALLEL_EXECUTION_ENABLED;
        protected Optional<Integer> threadPoolSize = Optional.empty();
        protected int attributionBefore = DEFAULT_ATTRIBUTION_BEFORE;
        protected int attributionAfter = DEFAULT_ATTRIBUTION_AFTER;

        void validate() {
            checkArgument(dimensions > 0, "dimensions must be greater than 0");
            checkNotNull(scorerKind, "scorer kind cannot be null");
            checkNotNull(martingaleKind, "martingale kind cannot be null");
            checkNotNull(thresholdMode, "threshold mode cannot be null");
            checkNotNull(referenceMode, "reference mode cannot be null");
            checkArgument(scorerKind.isMultivariate() || dimensions == 1,
                    "scorer " + scorerKind.getConfigName() + " only supports univariate data");
            checkArgument(epsilon > 0 && epsilon < 1, "epsilon must be in (0, 1)");
            checkArgument(jumpProbability >= 0 && jumpProbability <= 1, "jump probability must be in [0, 1]");
            checkArgument(alpha > 0 && alpha < 1, "alpha must be in (0, 1)");
            checkArgument(referenceWindow >= 0, "reference window cannot be negative");
            checkArgument(referenceMode == ReferenceMode.SLIDING
                    || referenceWindow >= INonconformityScorer.MINIMUM_REFERENCE_SIZE,
                    "an inductive reference set needs at least " + INonconformityScorer.MINIMUM_REFERENCE_SIZE
                            + " observations");
            checkArgument(calibrationWindow >= 0, "calibration window cannot be negative");
            checkArgument(thresholdWindow > 0, "threshold window must be positive");
            checkArgument(thresholdMultiplier > 0 && Double.isFinite(thresholdMultiplier),
                    "threshold multiplier must be positive");
            checkArgument(thresholdPercentile > 0 && thresholdPercentile <= 100,
                    "threshold percentile must be in (0, 100]");
            checkArgument(minConsecutive > 0, "min consecutive must be positive");
            checkArgument(relativeTolerance >= 0 && Double.isFinite(relativeTolerance),
                    "relative tolerance must be finite and non-negative");
            checkArgument(absoluteTolerance >= 0 && Double.isFinite(absoluteTolerance),
                    "absolute tolerance must be finite and non-negative");
            checkArgument(regularization > 0 && Double.isFinite(regularization), "regularization must be positive");
            threadPoolSize.ifPresent(n -> checkArgument(n > 0, "thread pool size must be positive"));
            checkArgument(attributionBefore > 0 && attributionAfter > 0, "attribution windows must be positive");
        }

        public DetectorConfig build() {
            validate();
            return new DetectorConfig(this);
        }

        public T dimensions(int dimensions) {
            this.dimensions = dimensions;
            return (T) this;
        }

        public T scorerKind(ScorerKind scorerKind) {
            this.scorerKind = scorerKind;
            return (T) this;
        }

        public T scorerKind(String name) {
            this.scorerKind = ScorerKind.fromName(name);
            return (T) this;
        }

        public T martingaleKind(MartingaleKind martingaleKind) {
            this.martingaleKind = martingaleKind;
            return (T) this;
        }

        public T martingaleKind(String name) {
            this.martingaleKind = MartingaleKind.fromName(name);
            return (T) this;
        }

        public T epsilon(double epsilon) {
            this.epsilon = epsilon;
            return (T) this;
        }

        public T jumpProbability(double jumpProbability) {
            this.jumpProbability = jumpProbability;
            return (T) this;
        }

        public T alpha(double alpha) {
            this.alpha = alpha;
            return (T) this;
        }

        public T referenceMode(ReferenceMode referenceMode) {
            this.referenceMode = referenceMode;
            return (T) this;
        }

        public T referenceMode(String name) {
            this.referenceMode = ReferenceMode.fromName(name);
            return (T) this;
        }

        public T referenceWindow(int referenceWindow) {
            this.referenceWindow = referenceWindow;
            return (T) this;
        }

        public T calibrationWindow(int calibrationWindow) {
            this.calibrationWindow = calibrationWindow;
            return (T) this;
        }

        /**
         * sets the size of the reference set; the calibration window is set
         * separately
         */
        public T window(int window) {
            this.referenceWindow = window;
            return (T) this;
        }

        public T thresholdMode(ThresholdMode thresholdMode) {
            this.thresholdMode = thresholdMode;
            return (T) this;
        }

        public T thresholdWindow(int thresholdWindow) {
            this.thresholdWindow = thresholdWindow;
            return (T) this;
        }

        public T thresholdMultiplier(double thresholdMultiplier) {
            this.thresholdMultiplier = thresholdMultiplier;
            return (T) this;
        }

        public T thresholdPercentile(double thresholdPercentile) {
            this.thresholdPercentile = thresholdPercentile;
            return (T) this;
        }

        public T minConsecutive(int minConsecutive) {
            this.minConsecutive = minConsecutive;
            return (T) this;
        }

        public T relativeTolerance(double relativeTolerance) {
            this.relativeTolerance = relativeTolerance;
            return (T) this;
        }

        public T absoluteTolerance(double absoluteTolerance) {
            this.absoluteTolerance = absoluteTolerance;
            return (T) this;
        }

        public T regularization(double regularization) {
            this.regularization = regularization;
            return (T) this;
        }

        public T useRandomizedPValue(boolean useRandomizedPValue) {
            this.useRandomizedPValue = useRandomizedPValue;
            return (T) this;
        }

        public T randomSeed(long randomSeed) {
            this.randomSeed = Optional.of(randomSeed);
            return (T) this;
        }

        public T parallelExecutionEnabled(boolean parallelExecutionEnabled) {
            this.parallelExecutionEnabled = parallelExecutionEnabled;
            return (T) this;
        }

        public T threadPoolSize(int threadPoolSize) {
            this.threadPoolSize = Optional.of(threadPoolSize);
            return (T) this;
        }

        public T attributionBefore(int attributionBefore) {
            this.attributionBefore = attributionBefore;
            return (T) this;
        }

        public T attributionAfter(int attributionAfter) {
            this.attributionAfter = attributionAfter;
            return (T) this;
        }
    }
}

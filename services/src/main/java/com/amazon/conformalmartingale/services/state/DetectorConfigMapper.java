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

package com.amazon.conformalmartingale.services.state;

import lombok.Getter;
import lombok.Setter;

import com.amazon.conformalmartingale.config.ReferenceMode;
import com.amazon.conformalmartingale.services.config.DetectorConfig;
import com.amazon.conformalmartingale.services.config.ThresholdMode;
import com.amazon.conformalmartingale.state.IStateMapper;

/**
 * The random seed of a configuration is part of its state; the seed argument
 * of {@link #toModel(DetectorConfigState, long)} is not used.
 */
@Getter
@Setter
public class DetectorConfigMapper implements IStateMapper<DetectorConfig, DetectorConfigState> {

    @Override
    public DetectorConfigState toState(DetectorConfig model) {
        DetectorConfigState state = new DetectorConfigState();
        state.setDimensions(model.getDimensions());
        state.setScorerKind(model.getScorerKind().getConfigName());
        state.setMartingaleKind(model.getMartingaleKind().getConfigName());
        state.setEpsilon(model.getEpsilon());
        state.setJumpProbability(model.getJumpProbability());
        state.setAlpha(model.getAlpha());
        state.setReferenceMode(model.getReferenceMode().name());
        state.setReferenceWindow(model.getReferenceWindow());
        state.setCalibrationWindow(model.getCalibrationWindow());
        state.setThresholdMode(model.getThresholdMode().name());
        state.setThresholdWindow(model.getThresholdWindow());
        state.setThresholdMultiplier(model.getThresholdMultiplier());
        state.setThresholdPercentile(model.getThresholdPercentile());
        state.setMinConsecutive(model.getMinConsecutive());
        state.setRelativeTolerance(model.getRelativeTolerance());
        state.setAbsoluteTolerance(model.getAbsoluteTolerance());
        state.setRegularization(model.getRegularization());
        state.setUseRandomizedPValue(model.isUseRandomizedPValue());
        state.setRandomSeed(model.getRandomSeed());
        state.setParallelExecutionEnabled(model.isParallelExecutionEnabled());
        state.setThreadPoolSize(model.getThreadPoolSize());
        state.setAttributionBefore(model.getAttributionBefore());
        state.setAttributionAfter(model.getAttributionAfter());
        return state;
    }

    @Override
    public DetectorConfig toModel(DetectorConfigState state, long seed) {
        return DetectorConfig.builder().dimensions(state.getDimensions()).scorerKind(state.getScorerKind())
                .martingaleKind(state.getMartingaleKind()).epsilon(state.getEpsilon())
                .jumpProbability(state.getJumpProbability()).alpha(state.getAlpha())
                .referenceMode(ReferenceMode.fromName(state.getReferenceMode()))
                .referenceWindow(state.getReferenceWindow()).calibrationWindow(state.getCalibrationWindow())
                .thresholdMode(ThresholdMode.fromName(state.getThresholdMode()))
                .thresholdWindow(state.getThresholdWindow()).thresholdMultiplier(state.getThresholdMultiplier())
                .thresholdPercentile(state.getThresholdPercentile()).minConsecutive(state.getMinConsecutive())
                .relativeTolerance(state.getRelativeTolerance()).absoluteTolerance(state.getAbsoluteTolerance())
                .regularization(state.getRegularization()).useRandomizedPValue(state.isUseRandomizedPValue())
                .randomSeed(state.getRandomSeed()).parallelExecutionEnabled(state.isParallelExecutionEnabled())
                .threadPoolSize(state.getThreadPoolSize()).attributionBefore(state.getAttributionBefore())
                .attributionAfter(state.getAttributionAfter()).build();
    }
}

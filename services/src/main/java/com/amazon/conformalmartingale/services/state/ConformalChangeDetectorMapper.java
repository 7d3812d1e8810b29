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

import static com.amazon.conformalmartingale.CommonUtils.checkArgument;
import static com.amazon.conformalmartingale.state.Version.V1_0;

import java.util.Arrays;

import lombok.Getter;
import lombok.Setter;

import com.amazon.conformalmartingale.martingale.IMartingale;
import com.amazon.conformalmartingale.pvalue.ConformalPValueEngine;
import com.amazon.conformalmartingale.services.ConformalChangeDetector;
import com.amazon.conformalmartingale.services.config.DetectorConfig;
import com.amazon.conformalmartingale.services.config.ThresholdMode;
import com.amazon.conformalmartingale.services.threshold.AdaptiveThreshold;
import com.amazon.conformalmartingale.services.threshold.DetectionState;
import com.amazon.conformalmartingale.services.threshold.IThreshold;
import com.amazon.conformalmartingale.services.threshold.PersistenceFilter;
import com.amazon.conformalmartingale.state.IStateMapper;
import com.amazon.conformalmartingale.state.martingale.MartingaleMapper;
import com.amazon.conformalmartingale.state.pvalue.ConformalPValueEngineMapper;

@Getter
@Setter
public class ConformalChangeDetectorMapper implements IStateMapper<ConformalChangeDetector, ConformalChangeDetectorState> {

    @Override
    public ConformalChangeDetectorState toState(ConformalChangeDetector model) {
        ConformalChangeDetectorState state = new ConformalChangeDetectorState();
        state.setConfigState(new DetectorConfigMapper().toState(model.getConfig()));
        state.setHistory(model.getReferenceSet());
        state.setPValueEngineState(new ConformalPValueEngineMapper().toState(model.getPValueEngine()));
        state.setMartingaleState(new MartingaleMapper().toState(model.getMartingale()));
        if (model.getThreshold() instanceof AdaptiveThreshold) {
            state.setThresholdValues(((AdaptiveThreshold) model.getThreshold()).getRecentValues());
        }
        state.setDetectionState(model.getPersistenceFilter().getState().name());
        state.setRunLength(model.getPersistenceFilter().getCount());
        state.setIndex(model.getIndex());
        return state;
    }

    @Override
    public ConformalChangeDetector toModel(ConformalChangeDetectorState state, long seed) {
        checkArgument(V1_0.equals(state.getVersion()), "unsupported state version " + state.getVersion());
        DetectorConfig config = new DetectorConfigMapper().toModel(state.getConfigState());
        ConformalPValueEngine engine = new ConformalPValueEngineMapper().toModel(state.getPValueEngineState());
        IMartingale martingale = new MartingaleMapper().toModel(state.getMartingaleState());
        IThreshold threshold = config.createThreshold();
        if (config.getThresholdMode() == ThresholdMode.ADAPTIVE && state.getThresholdValues() != null) {
            threshold = new AdaptiveThreshold(config.getAlpha(), config.getThresholdWindow(),
                    config.getThresholdMultiplier(), config.getThresholdPercentile(), state.getThresholdValues());
        }
        PersistenceFilter filter = new PersistenceFilter(config.getMinConsecutive(),
                DetectionState.valueOf(state.getDetectionState()), state.getRunLength());
        return new ConformalChangeDetector(config, Arrays.asList(state.getHistory()), engine, martingale, threshold,
                filter, state.getIndex());
    }
}

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

package com.amazon.conformalmartingale.state.pvalue;

import lombok.Getter;
import lombok.Setter;

import com.amazon.conformalmartingale.pvalue.ConformalPValueEngine;
import com.amazon.conformalmartingale.pvalue.TieTolerance;
import com.amazon.conformalmartingale.state.IStateMapper;

/**
 * The tie breaking draws are a function of the stored seed and index, so the
 * seed passed to {@link #toModel(ConformalPValueEngineState, long)} is not
 * used.
 */
@Getter
@Setter
public class ConformalPValueEngineMapper implements IStateMapper<ConformalPValueEngine, ConformalPValueEngineState> {

    @Override
    public ConformalPValueEngineState toState(ConformalPValueEngine model) {
        ConformalPValueEngineState state = new ConformalPValueEngineState();
        state.setCalibrationWindow(model.getCalibrationWindow());
        state.setRelativeTolerance(model.getTolerance().getRelativeTolerance());
        state.setAbsoluteTolerance(model.getTolerance().getAbsoluteTolerance());
        state.setSeed(model.getSeed());
        state.setIndex(model.getIndex());
        state.setScores(model.getRetainedScores());
        return state;
    }

    @Override
    public ConformalPValueEngine toModel(ConformalPValueEngineState state, long seed) {
        TieTolerance tolerance = new TieTolerance(state.getRelativeTolerance(), state.getAbsoluteTolerance());
        return new ConformalPValueEngine(state.getCalibrationWindow(), tolerance, state.getSeed(), state.getIndex(),
                state.getScores());
    }
}

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

package com.amazon.conformalmartingale.state.martingale;

import static com.amazon.conformalmartingale.CommonUtils.checkArgument;

import lombok.Getter;
import lombok.Setter;

import com.amazon.conformalmartingale.config.MartingaleKind;
import com.amazon.conformalmartingale.martingale.AbstractMartingale;
import com.amazon.conformalmartingale.martingale.IMartingale;
import com.amazon.conformalmartingale.martingale.PowerMartingale;
import com.amazon.conformalmartingale.martingale.SimpleJumperMartingale;
import com.amazon.conformalmartingale.state.IStateMapper;

@Getter
@Setter
public class MartingaleMapper implements IStateMapper<IMartingale, MartingaleState> {

    @Override
    public MartingaleState toState(IMartingale model) {
        MartingaleState state = new MartingaleState();
        state.setUpdates(model.getUpdates());
        state.setValue(model.getValue());
        if (model instanceof PowerMartingale) {
            state.setKind(MartingaleKind.POWER.getConfigName());
            state.setEpsilon(((PowerMartingale) model).getEpsilon());
        } else {
            checkArgument(model instanceof SimpleJumperMartingale, "unsupported martingale");
            SimpleJumperMartingale jumper = (SimpleJumperMartingale) model;
            state.setKind(MartingaleKind.SIMPLE_JUMPER.getConfigName());
            state.setJumpProbability(jumper.getJumpProbability());
            state.setCapital(jumper.getCapital());
        }
        return state;
    }

    @Override
    public IMartingale toModel(MartingaleState state, long seed) {
        AbstractMartingale martingale;
        if (MartingaleKind.fromName(state.getKind()) == MartingaleKind.POWER) {
            martingale = new PowerMartingale(state.getEpsilon(), state.getValue());
        } else {
            martingale = new SimpleJumperMartingale(state.getJumpProbability(), state.getCapital());
        }
        martingale.setUpdates(state.getUpdates());
        return martingale;
    }
}

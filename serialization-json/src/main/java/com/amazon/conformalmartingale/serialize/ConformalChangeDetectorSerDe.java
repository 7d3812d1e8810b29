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

package com.amazon.conformalmartingale.serialize;

import lombok.Getter;

import com.amazon.conformalmartingale.services.ConformalChangeDetector;
import com.amazon.conformalmartingale.services.state.ConformalChangeDetectorMapper;
import com.amazon.conformalmartingale.services.state.ConformalChangeDetectorState;
import com.google.gson.Gson;

/**
 * {@link ConformalChangeDetector} serialization. Internally we use the
 * {@link ConformalChangeDetectorMapper} class to convert a detector into a
 * corresponding state object, and we use
 * <a href="https://github.com/google/gson">Gson</a> to write the state object
 * as a JSON string. The Gson instance is exposed so users can customize the
 * output (e.g., by enabling pretty printing).
 */
@Getter
public class ConformalChangeDetectorSerDe {

    private final ConformalChangeDetectorMapper mapper;
    private final Gson gson;

    public ConformalChangeDetectorSerDe() {
        this(new ConformalChangeDetectorMapper(), new Gson());
    }

    /**
     * @param mapper converts a detector to a state object and back
     * @param gson   writes and reads {@link ConformalChangeDetectorState} objects
     */
    public ConformalChangeDetectorSerDe(ConformalChangeDetectorMapper mapper, Gson gson) {
        this.mapper = mapper;
        this.gson = gson;
    }

    /**
     * @param detector a detector
     * @return the JSON form of its state
     */
    public String toJson(ConformalChangeDetector detector) {
        return gson.toJson(mapper.toState(detector));
    }

    /**
     * @param json the output of {@link #toJson(ConformalChangeDetector)}
     * @return a detector that continues exactly where the serialized one stopped
     */
    public ConformalChangeDetector fromJson(String json) {
        ConformalChangeDetectorState state = gson.fromJson(json, ConformalChangeDetectorState.class);
        return mapper.toModel(state);
    }
}

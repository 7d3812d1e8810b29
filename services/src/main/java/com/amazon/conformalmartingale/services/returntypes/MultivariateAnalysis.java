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

package com.amazon.conformalmartingale.services.returntypes;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import lombok.Getter;

import com.amazon.conformalmartingale.services.attribution.Attribution;

/**
 * The analysis of every stream on its own, of the joint feature vector, and the
 * attribution of each change point of the joint analysis.
 */
@Getter
public class MultivariateAnalysis {

    /**
     * per stream analyses in column order
     */
    private final Map<String, SeriesAnalysis> streams;

    private final SeriesAnalysis joint;

    private final List<Attribution> attributions;

    public MultivariateAnalysis(Map<String, SeriesAnalysis> streams, SeriesAnalysis joint,
            List<Attribution> attributions) {
        this.streams = Collections.unmodifiableMap(streams);
        this.joint = joint;
        this.attributions = Collections.unmodifiableList(attributions);
    }

    public SeriesAnalysis getStream(String name) {
        return streams.get(name);
    }
}

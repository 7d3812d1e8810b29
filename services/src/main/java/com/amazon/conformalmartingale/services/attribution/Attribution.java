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

package com.amazon.conformalmartingale.services.attribution;

import java.util.Collections;
import java.util.List;

import lombok.Getter;
import lombok.ToString;

/**
 * The contributions of all features to one change point, largest total shift
 * first.
 */
@Getter
@ToString
public class Attribution {

    private final int changeIndex;

    private final List<FeatureContribution> contributions;

    public Attribution(int changeIndex, List<FeatureContribution> contributions) {
        this.changeIndex = changeIndex;
        this.contributions = Collections.unmodifiableList(contributions);
    }

    /**
     * @return the feature with the largest total shift
     */
    public FeatureContribution getTopContribution() {
        return contributions.get(0);
    }
}

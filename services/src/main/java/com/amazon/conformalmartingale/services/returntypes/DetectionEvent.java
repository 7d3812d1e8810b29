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

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A raw threshold crossing at an index, flagged as persisted when the run it
 * belongs to was confirmed by the persistence filter.
 */
@Getter
@ToString
@EqualsAndHashCode
public class DetectionEvent {

    private final int index;

    private final boolean persisted;

    public DetectionEvent(int index, boolean persisted) {
        this.index = index;
        this.persisted = persisted;
    }
}

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

package com.amazon.conformalmartingale.services.threshold;

import static com.amazon.conformalmartingale.CommonUtils.checkArgument;
import static com.amazon.conformalmartingale.CommonUtils.checkNotNull;

/**
 * Confirms a run of threshold crossings once it reaches minConsecutive points,
 * which suppresses isolated spikes. On confirmation the whole run is marked, not
 * only its last point; later crossings of the same run are marked as they
 * arrive. A point that does not cross ends the run.
 */
public class PersistenceFilter {

    private final int minConsecutive;

    private DetectionState state;

    // length of the current run of crossings
    private int count;

    public PersistenceFilter(int minConsecutive) {
        this(minConsecutive, DetectionState.BELOW, 0);
    }

    public PersistenceFilter(int minConsecutive, DetectionState state, int count) {
        checkArgument(minConsecutive > 0, "min consecutive must be positive");
        checkNotNull(state, "state cannot be null");
        checkArgument((state == DetectionState.BELOW) == (count == 0), "inconsistent run length");
        checkArgument(state != DetectionState.ARMED || count < minConsecutive, "inconsistent run length");
        checkArgument(state != DetectionState.CONFIRMED || count >= minConsecutive, "inconsistent run length");
        this.minConsecutive = minConsecutive;
        this.state = state;
        this.count = count;
    }

    /**
     * advances the state machine by one point
     *
     * @param crossing whether the point crossed the threshold
     * @return the number of most recent points (this one included) that are
     *         newly marked as detections: minConsecutive when the run is
     *         confirmed at this point, 1 while a confirmed run continues, 0
     *         otherwise
     */
    public int accept(boolean crossing) {
        if (!crossing) {
            state = DetectionState.BELOW;
            count = 0;
            return 0;
        }
        ++count;
        if (state == DetectionState.CONFIRMED) {
            return 1;
        }
        if (count >= minConsecutive) {
            state = DetectionState.CONFIRMED;
            return count;
        }
        state = DetectionState.ARMED;
        return 0;
    }

    /**
     * applies a fresh filter to a sequence of crossings
     *
     * @param crossings      raw threshold crossings
     * @param minConsecutive the required run length
     * @return the confirmed detections
     */
    public static boolean[] filter(boolean[] crossings, int minConsecutive) {
        checkNotNull(crossings, "crossings cannot be null");
        PersistenceFilter filter = new PersistenceFilter(minConsecutive);
        boolean[] detections = new boolean[crossings.length];
        for (int t = 0; t < crossings.length; t++) {
            int marked = filter.accept(crossings[t]);
            for (int j = t - marked + 1; j <= t; j++) {
                detections[j] = true;
            }
        }
        return detections;
    }

    public int getMinConsecutive() {
        return minConsecutive;
    }

    public DetectionState getState() {
        return state;
    }

    public int getCount() {
        return count;
    }
}

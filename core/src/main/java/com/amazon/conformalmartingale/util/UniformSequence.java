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

package com.amazon.conformalmartingale.util;

import java.util.SplittableRandom;

/**
 * An indexed sequence of uniform draws in [0, 1) derived from a single seed.
 * The draw for an index does not depend on which other indices were requested
 * before it, so a computation that is split, resumed or run in parallel sees
 * exactly the same values. Reading the indices 0, 1, 2, ... in order reproduces
 * the stream of {@code new SplittableRandom(seed).nextDouble()}.
 */
public class UniformSequence {

    // the increment SplittableRandom applies to its seed before every draw
    private static final long GOLDEN_GAMMA = 0x9e3779b97f4a7c15L;

    private final long seed;

    public UniformSequence(long seed) {
        this.seed = seed;
    }

    public double get(long index) {
        return new SplittableRandom(seed + GOLDEN_GAMMA * index).nextDouble();
    }

    public long getSeed() {
        return seed;
    }
}

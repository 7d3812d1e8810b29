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

package com.amazon.conformalmartingale.martingale;

import static com.amazon.conformalmartingale.CommonUtils.checkArgument;
import static com.amazon.conformalmartingale.CommonUtils.checkNotNull;

import java.util.Arrays;

/**
 * The Simple Jumper martingale. The wealth is split across three betting
 * directions epsilon in {-1, 0, +1} with betting factor 1 + epsilon * (p -
 * 1/2). Before every bet a fraction J of the total wealth is redistributed
 * evenly, which lets the mixture follow the direction that currently pays.
 */
public class SimpleJumperMartingale extends AbstractMartingale {

    public static final double DEFAULT_JUMP_PROBABILITY = 0.01;

    static final double[] DIRECTIONS = { -1.0, 0.0, 1.0 };

    private final double jumpProbability;

    private final double[] capital;

    public SimpleJumperMartingale() {
        this(DEFAULT_JUMP_PROBABILITY);
    }

    public SimpleJumperMartingale(double jumpProbability) {
        this(jumpProbability, new double[] { 1.0 / 3, 1.0 / 3, 1.0 / 3 });
    }

    public SimpleJumperMartingale(double jumpProbability, double[] capital) {
        checkArgument(jumpProbability >= 0 && jumpProbability <= 1, "jump probability has to be in [0, 1]");
        checkNotNull(capital, "capital cannot be null");
        checkArgument(capital.length == DIRECTIONS.length, "capital must have one entry per direction");
        for (double c : capital) {
            checkArgument(Double.isFinite(c) && c >= 0, "capital has to be finite and non-negative");
        }
        this.jumpProbability = jumpProbability;
        this.capital = Arrays.copyOf(capital, capital.length);
        checkArgument(total() > 0, "total capital has to be positive");
    }

    @Override
    protected double bet(double pValue) {
        double share = jumpProbability * total() / DIRECTIONS.length;
        for (int i = 0; i < DIRECTIONS.length; i++) {
            capital[i] = ((1 - jumpProbability) * capital[i] + share) * (1 + DIRECTIONS[i] * (pValue - 0.5));
        }
        double total = total();
        if (total > MAX_VALUE || total < MIN_VALUE) {
            double factor = ((total > MAX_VALUE) ? MAX_VALUE : MIN_VALUE) / total;
            for (int i = 0; i < DIRECTIONS.length; i++) {
                capital[i] *= factor;
            }
            return total();
        }
        return total;
    }

    private double total() {
        double sum = 0;
        for (double c : capital) {
            sum += c;
        }
        return sum;
    }

    @Override
    public double getValue() {
        return total();
    }

    public double getJumpProbability() {
        return jumpProbability;
    }

    /**
     * @return a copy of the wealth held by each direction
     */
    public double[] getCapital() {
        return Arrays.copyOf(capital, capital.length);
    }
}

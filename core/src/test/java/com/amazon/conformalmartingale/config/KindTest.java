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

package com.amazon.conformalmartingale.config;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import com.amazon.conformalmartingale.martingale.PowerMartingale;
import com.amazon.conformalmartingale.martingale.SimpleJumperMartingale;
import com.amazon.conformalmartingale.scoring.AbstractScorer;
import com.amazon.conformalmartingale.scoring.MahalanobisScorer;

public class KindTest {

    @ParameterizedTest
    @EnumSource(ScorerKind.class)
    public void testScorerNames(ScorerKind kind) {
        assertEquals(kind, ScorerKind.fromName(kind.getConfigName()));
        assertEquals(kind, ScorerKind.fromName(kind.name().toLowerCase()));
        assertEquals(kind.isMultivariate(), ((AbstractScorer) kind.create(1e-6)).isMultivariate());
    }

    @ParameterizedTest
    @EnumSource(MartingaleKind.class)
    public void testMartingaleNames(MartingaleKind kind) {
        assertEquals(kind, MartingaleKind.fromName(kind.getConfigName()));
        assertEquals(1.0, kind.create(0.9, 0.01).getValue(), 1e-12);
    }

    @Test
    public void testReferenceModes() {
        assertEquals(ReferenceMode.INDUCTIVE, ReferenceMode.fromName("inductive"));
        assertEquals(25, ReferenceMode.INDUCTIVE.getTrainingLength(25));
        assertEquals(0, ReferenceMode.SLIDING.getTrainingLength(25));
        assertThrows(IllegalArgumentException.class, () -> ReferenceMode.fromName("expanding"));
    }

    @Test
    public void testResolution() {
        assertFalse(ScorerKind.MEAN_DEVIATION.isMultivariate());
        assertTrue(ScorerKind.MAHALANOBIS.isMultivariate());
        assertEquals(0.5, ((MahalanobisScorer) ScorerKind.MAHALANOBIS.create(0.5)).getRegularization());
        assertThat(MartingaleKind.POWER.create(0.9, 0.01), instanceOf(PowerMartingale.class));
        assertEquals(0.9, ((PowerMartingale) MartingaleKind.POWER.create(0.9, 0.01)).getEpsilon());
        assertEquals(0.2,
                ((SimpleJumperMartingale) MartingaleKind.SIMPLE_JUMPER.create(0.9, 0.2)).getJumpProbability());
    }

    @Test
    public void testUnknownNames() {
        assertThrows(IllegalArgumentException.class, () -> ScorerKind.fromName("knn"));
        assertThrows(IllegalArgumentException.class, () -> MartingaleKind.fromName("plugin"));
        assertThrows(NullPointerException.class, () -> ScorerKind.fromName(null));
    }
}

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

package com.amazon.conformalmartingale;

import static com.amazon.conformalmartingale.CommonUtils.checkArgument;
import static com.amazon.conformalmartingale.CommonUtils.checkNotNull;
import static com.amazon.conformalmartingale.CommonUtils.checkShape;
import static com.amazon.conformalmartingale.CommonUtils.checkState;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

public class CommonUtilsTest {

    @Test
    public void testChecks() {
        assertDoesNotThrow(() -> checkArgument(true, "ok"));
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> checkArgument(false, "bad"));
        assertEquals("bad", e.getMessage());
        assertThrows(IllegalStateException.class, () -> checkState(false, "bad"));
        assertThrows(NullPointerException.class, () -> checkNotNull(null, "bad"));
        assertEquals("x", checkNotNull("x", "bad"));
    }

    @Test
    public void testCheckShape() {
        assertEquals(2, checkShape(new double[][] { { 1, 2 }, { 3, 4 } }));
        assertThrows(IllegalArgumentException.class, () -> checkShape(new double[][] { { 1, 2 }, { 3 } }));
        assertThrows(IllegalArgumentException.class, () -> checkShape(new double[0][]));
        assertThrows(IllegalArgumentException.class, () -> checkShape(new double[][] { {} }));
        assertThrows(NullPointerException.class, () -> checkShape(new double[][] { { 1 }, null }));
    }

    @Test
    public void testColumns() {
        double[][] table = CommonUtils.toColumn(new double[] { 1, 2, 3 });
        assertEquals(3, table.length);
        assertArrayEquals(new double[] { 2 }, table[1]);
        assertArrayEquals(new double[] { 1, 2, 3 }, CommonUtils.getColumn(table, 0));
        assertEquals(1.0, CommonUtils.clip(5, 0, 1));
        assertEquals(-1.0, CommonUtils.clip(-3, -1, 1));
    }
}

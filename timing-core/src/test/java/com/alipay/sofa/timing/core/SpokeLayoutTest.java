/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.alipay.sofa.timing.core;

import java.util.concurrent.TimeUnit;

import org.junit.Test;

import static org.junit.Assert.assertEquals;

public class SpokeLayoutTest {

    private static final long TEN_MS = TimeUnit.MILLISECONDS.toNanos(10);

    @Test
    public void testMainLevel() {
        assertEquals(0, SpokeLayout.spokeIndex(0, 0));
        assertEquals(5, SpokeLayout.spokeIndex(5, 0));
        assertEquals(255, SpokeLayout.spokeIndex(255, 0));
        // slot follows the deadline bits, not the distance
        assertEquals(2028 & 0xFF, SpokeLayout.spokeIndex(2028, 2024));
        assertEquals(44, SpokeLayout.spokeIndex(300, 100));
    }

    @Test
    public void testLevelBoundaries() {
        assertEquals(SpokeLayout.MAIN_LEVEL, SpokeLayout.levelOf(SpokeLayout.spokeIndex(255, 0)));
        assertEquals(257, SpokeLayout.spokeIndex(256, 0));
        assertEquals(319, SpokeLayout.spokeIndex((1 << 14) - 1, 0));
        assertEquals(321, SpokeLayout.spokeIndex(1 << 14, 0));
        assertEquals(385, SpokeLayout.spokeIndex(1 << 20, 0));
        assertEquals(449, SpokeLayout.spokeIndex(1 << 26, 0));
        // the longest distance lands on the last level
        assertEquals(511, SpokeLayout.spokeIndex(0xFFFFFFFF, 0));

        assertEquals(0, SpokeLayout.levelOf(257));
        assertEquals(1, SpokeLayout.levelOf(321));
        assertEquals(2, SpokeLayout.levelOf(385));
        assertEquals(3, SpokeLayout.levelOf(511));
    }

    @Test
    public void testWrapAround() {
        final int curTick = 0xFFFFFFF0;
        // 20 ticks ahead, past the 32-bit boundary
        assertEquals(4, SpokeLayout.spokeIndex(curTick + 20, curTick));
        // 300 ticks ahead: level 0, slot of bits 8..13 of the wrapped deadline
        final int next = curTick + 300;
        assertEquals(SpokeLayout.cascadeSpoke(0, (next >>> 8) & 0x3F), SpokeLayout.spokeIndex(next, curTick));
        assertEquals(0, SpokeLayout.levelOf(SpokeLayout.spokeIndex(next, curTick)));
    }

    @Test
    public void testCascadeIndex() {
        assertEquals(1, SpokeLayout.cascadeIndex(256, 0));
        assertEquals(0, SpokeLayout.cascadeIndex(1 << 14, 0));
        assertEquals(1, SpokeLayout.cascadeIndex(1 << 14, 1));
        assertEquals(63, SpokeLayout.cascadeIndex(0xFFFFFFFF, 3));
        assertEquals(256 + 64 * 2 + 5, SpokeLayout.cascadeSpoke(2, 5));
    }

    @Test
    public void testNextTimeoutRoundsUp() {
        assertEquals(5, SpokeLayout.nextTimeout(0, TimeUnit.MILLISECONDS.toNanos(50), TEN_MS));
        assertEquals(6, SpokeLayout.nextTimeout(1, TimeUnit.MILLISECONDS.toNanos(50), TEN_MS));
        assertEquals(3, SpokeLayout.nextTimeout(0, TimeUnit.MILLISECONDS.toNanos(25), TEN_MS));
        assertEquals(0, SpokeLayout.nextTimeout(0, 0, TEN_MS));
        assertEquals(0, SpokeLayout.nextTimeout(-1, 0, TEN_MS));
    }

    @Test
    public void testToTick() {
        assertEquals(0, SpokeLayout.toTick(TEN_MS - 1, TEN_MS));
        assertEquals(1, SpokeLayout.toTick(TEN_MS, TEN_MS));
        assertEquals(-1, SpokeLayout.toTick(-1, TEN_MS));
        // only the low 32 bits are kept
        assertEquals(0, SpokeLayout.toTick((1L << 32) * TEN_MS, TEN_MS));
    }
}

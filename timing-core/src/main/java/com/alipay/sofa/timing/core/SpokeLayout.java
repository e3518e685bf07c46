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

/**
 * Addressing of the 512 spokes of a hierarchical timing wheel.
 *
 * <p>The 32-bit tick counter is decomposed like a radix: the low 8 bits index
 * the 256 spokes of the main level, every following 6 bits index the 64 spokes
 * of one of the four cascade levels. The spoke array is laid out as
 * <pre>
 *   [0, 256)            main level
 *   [256 + 64 * L, ...) cascade level L, L in [0, 4)
 * </pre>
 *
 * <p>Ticks are unsigned 32-bit values stored in {@code int}s, all arithmetic
 * wraps.
 */
public final class SpokeLayout {

    public static final int MAIN_BITS    = 8;
    public static final int LEVEL_BITS   = 6;
    public static final int LEVELS       = 4;
    public static final int MAIN_SIZE    = 1 << MAIN_BITS;
    public static final int LEVEL_SIZE   = 1 << LEVEL_BITS;
    public static final int MAIN_MASK    = MAIN_SIZE - 1;
    public static final int LEVEL_MASK   = LEVEL_SIZE - 1;
    public static final int SPOKE_COUNT  = MAIN_SIZE + LEVEL_SIZE * LEVELS;

    /** Level reported for main level spokes. */
    public static final int MAIN_LEVEL   = -1;

    /** Longest distance in ticks a deadline may be placed from now. */
    public static final long MAX_TICKS   = Integer.MAX_VALUE;

    /**
     * Index of the spoke holding an entry due at {@code next} when the wheel
     * stands at {@code curTick}.
     */
    public static int spokeIndex(final int next, final int curTick) {
        int idx = next - curTick;
        if ((idx & ~MAIN_MASK) == 0) {
            return next & MAIN_MASK;
        }
        int level = 0;
        for (idx >>>= MAIN_BITS; idx >= LEVEL_SIZE && level < LEVELS - 1; level++) {
            idx >>>= LEVEL_BITS;
        }
        return cascadeSpoke(level, (next >>> levelShift(level)) & LEVEL_MASK);
    }

    /**
     * Slot of cascade level {@code level} that is demoted when the wheel
     * reaches {@code curTick}.
     */
    public static int cascadeIndex(final int curTick, final int level) {
        return (curTick >>> levelShift(level)) & LEVEL_MASK;
    }

    public static int cascadeSpoke(final int level, final int index) {
        return MAIN_SIZE + LEVEL_SIZE * level + index;
    }

    /**
     * Level of a spoke, {@link #MAIN_LEVEL} for the main level.
     */
    public static int levelOf(final int spoke) {
        if (spoke < MAIN_SIZE) {
            return MAIN_LEVEL;
        }
        return (spoke - MAIN_SIZE) / LEVEL_SIZE;
    }

    /**
     * Smallest tick at or after {@code nowNanos + timeoutNanos}.
     */
    public static int nextTimeout(final long nowNanos, final long timeoutNanos, final long granularityNanos) {
        return (int) Math.floorDiv(nowNanos + timeoutNanos + granularityNanos - 1, granularityNanos);
    }

    /**
     * The tick {@code nowNanos} falls into.
     */
    public static int toTick(final long nowNanos, final long granularityNanos) {
        return (int) Math.floorDiv(nowNanos, granularityNanos);
    }

    private static int levelShift(final int level) {
        return MAIN_BITS + LEVEL_BITS * level;
    }

    private SpokeLayout() {
    }
}

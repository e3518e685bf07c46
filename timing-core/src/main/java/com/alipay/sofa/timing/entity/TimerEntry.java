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
package com.alipay.sofa.timing.entity;

import com.alipay.sofa.timing.Job;
import com.alipay.sofa.timing.util.LinkedNode;
import com.alipay.sofa.timing.util.Requires;

/**
 * One scheduled job of a timing wheel, also the handle callers keep to
 * restart, modify or delete it.
 *
 * <p>An entry is created detached. The wheel links it into one of its spokes
 * once it is started and moves it between spokes while time passes. After the
 * last firing, or after a delete, it is detached again and belongs to the
 * caller, who may restart it.
 *
 * <p>All mutable state is guarded by the lock of the wheel that owns the entry.
 */
public class TimerEntry extends LinkedNode<TimerEntry> {

    /** Target count of an entry that fires exactly once. */
    public static final int ONE_SHOT = 1;
    /** Target count of an entry that fires until deleted. */
    public static final int PERSIST  = 0;

    private final Job       job;
    private final int       targetCount;
    private long            intervalNanos;
    // unsigned 32-bit tick the entry is next due at
    private int             deadlineTick;
    private int             firedCount;

    public TimerEntry(final Job job, final int targetCount, final long intervalNanos) {
        Requires.requireNonNull(job, "job");
        Requires.requireTrue(targetCount >= 0, "targetCount must not be negative: %d", targetCount);
        Requires.requireTrue(intervalNanos >= 0, "interval must not be negative: %d", intervalNanos);
        this.job = job;
        this.targetCount = targetCount;
        this.intervalNanos = intervalNanos;
    }

    public Job getJob() {
        return this.job;
    }

    public boolean isPersist() {
        return this.targetCount == PERSIST;
    }

    public long getIntervalNanos() {
        return this.intervalNanos;
    }

    public void setIntervalNanos(final long intervalNanos) {
        Requires.requireTrue(intervalNanos >= 0, "interval must not be negative: %d", intervalNanos);
        this.intervalNanos = intervalNanos;
    }

    public int getDeadlineTick() {
        return this.deadlineTick;
    }

    public void setDeadlineTick(final int deadlineTick) {
        this.deadlineTick = deadlineTick;
    }

    public int getFiredCount() {
        return this.firedCount;
    }

    public void resetFiredCount() {
        this.firedCount = 0;
    }

    /**
     * Count one more firing.
     *
     * @return true if the entry wants to fire again afterwards
     */
    public boolean markFired() {
        this.firedCount++;
        return isPersist() || this.firedCount < this.targetCount;
    }

    @Override
    public String toString() {
        return "TimerEntry [job=" + this.job + ", deadlineTick=" + Integer.toUnsignedString(this.deadlineTick)
               + ", firedCount=" + this.firedCount + ", targetCount=" + this.targetCount + ", intervalNanos="
               + this.intervalNanos + ", linked=" + isLinked() + "]";
    }
}

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
package com.alipay.sofa.timing;

import java.util.concurrent.TimeUnit;

import com.alipay.sofa.timing.core.WheelMetrics;
import com.alipay.sofa.timing.entity.TimerEntry;
import com.alipay.sofa.timing.option.TimingWheelOptions;
import com.alipay.sofa.timing.util.Describer;

/**
 * A hierarchical timing wheel, schedules one-shot, bounded and persistent jobs
 * with O(1) insertion, cancellation and per tick cost.
 *
 * <p>Time is cut into ticks of {@link TimingWheelOptions#getGranularityMs()}.
 * A dedicated worker thread, started by {@link #run()}, advances the wheel and
 * runs the jobs that became due. Jobs run with the wheel unlocked but strictly
 * one after another, so a slow job delays all later ones.
 *
 * <p>All methods are thread safe.
 */
public interface TimingWheel extends Lifecycle<TimingWheelOptions>, Describer {

    /**
     * Start the worker thread, a no-op when already running.
     *
     * @return this wheel
     */
    TimingWheel run();

    /**
     * Stop the worker thread, a no-op when not running. Pending entries are
     * kept and an in-flight job is neither interrupted nor waited for.
     */
    void close();

    /**
     * Whether the worker thread is running.
     */
    boolean isRunning();

    /**
     * Number of scheduled entries, including the ones due but not fired yet.
     */
    int size();

    /**
     * Get the metrics of the wheel, a no-op holder when metrics are disabled.
     */
    WheelMetrics getMetrics();

    /**
     * Create a detached entry using the default interval, arm it later with
     * {@link #start(TimerEntry)}.
     *
     * @param job         the job to fire
     * @param targetCount times to fire, {@link TimerEntry#PERSIST} for ever
     */
    TimerEntry newJob(final Job job, final int targetCount);

    /**
     * Create a detached entry, arm it later with {@link #start(TimerEntry)}.
     */
    TimerEntry newJob(final Job job, final int targetCount, final long interval, final TimeUnit unit);

    TimerEntry newJobFunc(final Runnable func, final int targetCount, final long interval, final TimeUnit unit);

    /**
     * Create an entry using the default interval and schedule it.
     *
     * @return the entry handle
     */
    TimerEntry addJob(final Job job, final int targetCount);

    /**
     * Create an entry and schedule it to fire {@code interval} from now, then
     * every {@code interval} until it has fired {@code targetCount} times.
     *
     * @return the entry handle
     */
    TimerEntry addJob(final Job job, final int targetCount, final long interval, final TimeUnit unit);

    TimerEntry addOneShotJob(final Job job);

    TimerEntry addOneShotJob(final Job job, final long interval, final TimeUnit unit);

    TimerEntry addPersistJob(final Job job);

    TimerEntry addPersistJob(final Job job, final long interval, final TimeUnit unit);

    TimerEntry addJobFunc(final Runnable func, final int targetCount, final long interval, final TimeUnit unit);

    TimerEntry addOneShotJobFunc(final Runnable func, final long interval, final TimeUnit unit);

    TimerEntry addPersistJobFunc(final Runnable func, final long interval, final TimeUnit unit);

    /**
     * Arm or re-arm an entry: it is detached from wherever it is, its fired
     * count is reset and it is scheduled one interval from now.
     */
    void start(final TimerEntry entry);

    /**
     * Cancel an entry. Deleting an entry that is not scheduled is a no-op. A
     * job that is already running is not interrupted.
     *
     * @return true if the entry was scheduled
     */
    boolean delete(final TimerEntry entry);

    /**
     * Change the interval of an entry and re-arm it, its fired count starts
     * over from zero.
     */
    void modify(final TimerEntry entry, final long interval, final TimeUnit unit);
}

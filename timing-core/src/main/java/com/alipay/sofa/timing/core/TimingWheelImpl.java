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

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import javax.annotation.concurrent.ThreadSafe;

import org.apache.commons.lang.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.alipay.sofa.timing.Job;
import com.alipay.sofa.timing.TimingWheel;
import com.alipay.sofa.timing.entity.TimerEntry;
import com.alipay.sofa.timing.job.FuncJob;
import com.alipay.sofa.timing.option.TimingWheelOptions;
import com.alipay.sofa.timing.util.Clock;
import com.alipay.sofa.timing.util.LinkedNodeList;
import com.alipay.sofa.timing.util.NamedThreadFactory;
import com.alipay.sofa.timing.util.OnlyForTest;
import com.alipay.sofa.timing.util.Requires;
import com.codahale.metrics.Gauge;

/**
 * Hierarchical timing wheel with a main level of 256 spokes and four cascade
 * levels of 64 spokes, see {@link SpokeLayout}.
 *
 * <p>A single read/write lock guards the spokes, the due list, the current
 * tick and the running flag. The worker holds the write lock while it advances
 * ticks and moves due entries, and releases it around every job so that a slow
 * job never blocks callers adding or deleting entries. Jobs are serialized by a
 * separate job lock, also across a close() and run() of the worker.
 */
@ThreadSafe
public class TimingWheelImpl implements TimingWheel {

    private static final Logger              LOG         = LoggerFactory.getLogger(TimingWheelImpl.class);

    /** Id of the due list, spokes use their index. */
    public static final int                  DUE_NOW_ID  = -1;

    private final ReentrantReadWriteLock     rwLock      = new ReentrantReadWriteLock();
    private final Lock                       readLock    = this.rwLock.readLock();
    private final Lock                       writeLock   = this.rwLock.writeLock();
    // held while a job runs, never together with the write lock
    private final Lock                       jobLock     = new ReentrantLock();

    private LinkedNodeList<TimerEntry>[]     spokes;
    /**
     * Entries due at the current tick, waiting for their job to run
     */
    private LinkedNodeList<TimerEntry>       doNow;
    // unsigned 32-bit tick the wheel stands at
    private int                              curTick;

    private String                           name;
    private long                             granularityNanos;
    private long                             defaultIntervalNanos;
    private Clock                            clock;
    private Executor                         jobExecutor;
    private ThreadFactory                    threadFactory;
    private WheelMetrics                     metrics;

    private volatile boolean                 initialized;
    private volatile boolean                 destroyed;
    private boolean                          running;
    private Worker                           worker;

    @SuppressWarnings("unchecked")
    @Override
    public boolean init(final TimingWheelOptions opts) {
        Requires.requireNonNull(opts, "Null timing wheel options");
        if (opts.getGranularityMs() <= 0) {
            LOG.error("Invalid granularityMs: {}, it must be positive.", opts.getGranularityMs());
            return false;
        }
        if (opts.getDefaultIntervalMs() < 0) {
            LOG.error("Invalid defaultIntervalMs: {}, it must not be negative.", opts.getDefaultIntervalMs());
            return false;
        }
        if (StringUtils.isBlank(opts.getName())) {
            LOG.error("Timing wheel name is blank.");
            return false;
        }
        if (opts.getClock() == null) {
            LOG.error("Timing wheel clock is null.");
            return false;
        }
        final long granularity = TimeUnit.MILLISECONDS.toNanos(opts.getGranularityMs());
        final long defaultInterval = TimeUnit.MILLISECONDS.toNanos(opts.getDefaultIntervalMs());
        if (defaultInterval / granularity > SpokeLayout.MAX_TICKS) {
            LOG.error("defaultIntervalMs {} is beyond the horizon of the wheel.", opts.getDefaultIntervalMs());
            return false;
        }

        this.writeLock.lock();
        try {
            if (this.initialized) {
                LOG.warn("Timing wheel {} is already initialized.", this.name);
                return true;
            }
            this.name = opts.getName();
            this.granularityNanos = granularity;
            this.defaultIntervalNanos = defaultInterval;
            this.clock = opts.getClock();
            this.jobExecutor = opts.getJobExecutor();
            this.threadFactory = new NamedThreadFactory(this.name + "-worker-", opts.isDaemon());
            this.metrics = new WheelMetrics(opts.isEnableMetrics());

            this.spokes = new LinkedNodeList[SpokeLayout.SPOKE_COUNT];
            for (int i = 0; i < this.spokes.length; i++) {
                this.spokes[i] = new LinkedNodeList<>(i);
            }
            this.doNow = new LinkedNodeList<>(DUE_NOW_ID);
            this.curTick = SpokeLayout.toTick(this.clock.nanoTime(), this.granularityNanos);

            if (this.metrics.isEnabled()) {
                this.metrics.getMetricRegistry().register("pending-entries", (Gauge<Integer>) this::size);
                this.metrics.getMetricRegistry().register("current-tick", (Gauge<Long>) this::currentTick);
            }
            this.initialized = true;
        } finally {
            this.writeLock.unlock();
        }
        LOG.info("Timing wheel {} initialized with {}.", this.name, opts);
        return true;
    }

    @Override
    public void shutdown() {
        close();
        this.writeLock.lock();
        try {
            if (this.destroyed) {
                return;
            }
            this.destroyed = true;
        } finally {
            this.writeLock.unlock();
        }
        LOG.info("Timing wheel {} shutdown, {} entries dropped.", this.name, size());
    }

    @Override
    public TimingWheel run() {
        this.writeLock.lock();
        try {
            checkState();
            if (this.running) {
                return this;
            }
            this.running = true;
            this.worker = new Worker();
            this.threadFactory.newThread(this.worker).start();
        } finally {
            this.writeLock.unlock();
        }
        LOG.info("Timing wheel {} is running.", this.name);
        return this;
    }

    @Override
    public void close() {
        this.writeLock.lock();
        try {
            if (!this.running) {
                return;
            }
            this.running = false;
            this.worker.stop();
            this.worker = null;
        } finally {
            this.writeLock.unlock();
        }
        LOG.info("Timing wheel {} is closed.", this.name);
    }

    @Override
    public boolean isRunning() {
        this.readLock.lock();
        try {
            return this.running;
        } finally {
            this.readLock.unlock();
        }
    }

    @Override
    public int size() {
        this.readLock.lock();
        try {
            if (!this.initialized) {
                return 0;
            }
            int length = this.doNow.size();
            for (final LinkedNodeList<TimerEntry> spoke : this.spokes) {
                length += spoke.size();
            }
            return length;
        } finally {
            this.readLock.unlock();
        }
    }

    @Override
    public TimerEntry newJob(final Job job, final int targetCount) {
        return newEntry(job, targetCount, this.defaultIntervalNanos);
    }

    @Override
    public TimerEntry newJob(final Job job, final int targetCount, final long interval, final TimeUnit unit) {
        Requires.requireNonNull(unit, "unit");
        return newEntry(job, targetCount, unit.toNanos(interval));
    }

    @Override
    public TimerEntry newJobFunc(final Runnable func, final int targetCount, final long interval, final TimeUnit unit) {
        return newJob(FuncJob.of(func), targetCount, interval, unit);
    }

    @Override
    public TimerEntry addJob(final Job job, final int targetCount) {
        return schedule(newJob(job, targetCount));
    }

    @Override
    public TimerEntry addJob(final Job job, final int targetCount, final long interval, final TimeUnit unit) {
        return schedule(newJob(job, targetCount, interval, unit));
    }

    @Override
    public TimerEntry addOneShotJob(final Job job) {
        return addJob(job, TimerEntry.ONE_SHOT);
    }

    @Override
    public TimerEntry addOneShotJob(final Job job, final long interval, final TimeUnit unit) {
        return addJob(job, TimerEntry.ONE_SHOT, interval, unit);
    }

    @Override
    public TimerEntry addPersistJob(final Job job) {
        return addJob(job, TimerEntry.PERSIST);
    }

    @Override
    public TimerEntry addPersistJob(final Job job, final long interval, final TimeUnit unit) {
        return addJob(job, TimerEntry.PERSIST, interval, unit);
    }

    @Override
    public TimerEntry addJobFunc(final Runnable func, final int targetCount, final long interval, final TimeUnit unit) {
        return addJob(FuncJob.of(func), targetCount, interval, unit);
    }

    @Override
    public TimerEntry addOneShotJobFunc(final Runnable func, final long interval, final TimeUnit unit) {
        return addJobFunc(func, TimerEntry.ONE_SHOT, interval, unit);
    }

    @Override
    public TimerEntry addPersistJobFunc(final Runnable func, final long interval, final TimeUnit unit) {
        return addJobFunc(func, TimerEntry.PERSIST, interval, unit);
    }

    @Override
    public void start(final TimerEntry entry) {
        Requires.requireNonNull(entry, "entry");
        this.writeLock.lock();
        try {
            checkState();
            // should remove from the old spoke first
            entry.removeSelf();
            entry.resetFiredCount();
            place(entry);
        } finally {
            this.writeLock.unlock();
        }
    }

    @Override
    public boolean delete(final TimerEntry entry) {
        Requires.requireNonNull(entry, "entry");
        this.writeLock.lock();
        try {
            return entry.removeSelf();
        } finally {
            this.writeLock.unlock();
        }
    }

    @Override
    public void modify(final TimerEntry entry, final long interval, final TimeUnit unit) {
        Requires.requireNonNull(entry, "entry");
        Requires.requireNonNull(unit, "unit");
        final long intervalNanos = unit.toNanos(interval);
        this.writeLock.lock();
        try {
            checkState();
            checkInterval(intervalNanos);
            entry.removeSelf();
            entry.setIntervalNanos(intervalNanos);
            entry.resetFiredCount();
            place(entry);
        } finally {
            this.writeLock.unlock();
        }
    }

    private TimerEntry newEntry(final Job job, final int targetCount, final long intervalNanos) {
        checkInterval(intervalNanos);
        return new TimerEntry(job, targetCount, intervalNanos);
    }

    private TimerEntry schedule(final TimerEntry entry) {
        this.writeLock.lock();
        try {
            checkState();
            place(entry);
        } finally {
            this.writeLock.unlock();
        }
        return entry;
    }

    /**
     * Compute the deadline of a detached entry from now and link it, an entry
     * due at the current tick goes straight to the due list. Called with the
     * write lock held.
     */
    private void place(final TimerEntry entry) {
        final int next = nextTimeout(this.clock.nanoTime(), entry.getIntervalNanos());
        entry.setDeadlineTick(next);
        if (next == this.curTick) {
            this.doNow.pushBack(entry);
            return;
        }
        addTimer(entry);
    }

    private void addTimer(final TimerEntry entry) {
        this.spokes[SpokeLayout.spokeIndex(entry.getDeadlineTick(), this.curTick)].pushBack(entry);
    }

    /**
     * Demote the cascade slot the current tick points at, and the one of the
     * next level each time a level wraps around.
     */
    private void cascade() {
        for (int level = 0; level < SpokeLayout.LEVELS; level++) {
            final int index = SpokeLayout.cascadeIndex(this.curTick, level);
            final LinkedNodeList<TimerEntry> spoke = this.spokes[SpokeLayout.cascadeSpoke(level, index)];
            TimerEntry entry;
            while ((entry = spoke.popFront()) != null) {
                addTimer(entry);
            }
            if (index != 0) {
                break;
            }
        }
    }

    private int nextTimeout(final long nowNanos, final long timeoutNanos) {
        return SpokeLayout.nextTimeout(nowNanos, timeoutNanos, this.granularityNanos);
    }

    /**
     * Process every tick elapsed up to {@code nowNanos}, then fire the due
     * entries in order.
     *
     * @param worker the calling worker, the pass stops early once it is stopped;
     *               null when driven by hand
     */
    private void advance(final long nowNanos, final Worker worker) {
        this.writeLock.lock();
        try {
            if (worker != null && worker.stopped) {
                return;
            }
            int past = SpokeLayout.toTick(nowNanos, this.granularityNanos) - this.curTick;
            if (past < 0) {
                LOG.warn("Clock of timing wheel {} went backwards by {} ticks, skip this pass.", this.name, -past);
                past = 0;
            } else if (past > 1) {
                this.metrics.recordSize("tick-catch-up", past);
            }
            for (; past > 0; past--) {
                this.curTick++;
                final int index = this.curTick & SpokeLayout.MAIN_MASK;
                if (index == 0) {
                    cascade();
                }
                this.doNow.spliceBack(this.spokes[index]);
            }

            int fired = 0;
            TimerEntry entry;
            while ((entry = this.doNow.popFront()) != null) {
                if (entry.markFired()) {
                    int next = nextTimeout(nowNanos, entry.getIntervalNanos());
                    if (next - this.curTick <= 0) {
                        // a zero interval entry fires once per tick
                        next = this.curTick + 1;
                    }
                    entry.setDeadlineTick(next);
                    addTimer(entry);
                }
                fired++;
                final Job job = entry.getJob();
                this.writeLock.unlock();
                try {
                    runJob(job);
                } finally {
                    this.writeLock.lock();
                }
                if (worker != null && worker.stopped) {
                    break;
                }
            }
            if (fired > 0) {
                this.metrics.mark("job-fired", fired);
                this.metrics.recordSize("tick-due-entries", fired);
            }
        } finally {
            this.writeLock.unlock();
        }
    }

    private void runJob(final Job job) {
        // a worker started by run() right after close() waits here for the
        // old worker to leave its job
        this.jobLock.lock();
        try {
            if (this.jobExecutor == null) {
                invokeJob(job);
                return;
            }
            this.jobExecutor.execute(() -> invokeJob(job));
        } catch (final RejectedExecutionException e) {
            LOG.warn("Job {} of timing wheel {} is rejected by the executor.", job, this.name, e);
            this.metrics.recordTimes("job-failures", 1);
        } finally {
            this.jobLock.unlock();
        }
    }

    private void invokeJob(final Job job) {
        final long startNanos = System.nanoTime();
        try {
            job.run();
        } catch (final Throwable t) {
            LOG.warn("An exception was thrown by job {} of timing wheel {}.", job, this.name, t);
            this.metrics.recordTimes("job-failures", 1);
        } finally {
            this.metrics.recordLatency("job-run", System.nanoTime() - startNanos);
        }
    }

    private void checkState() {
        checkInitialized();
        if (this.destroyed) {
            throw new IllegalStateException("Timing wheel " + this.name + " is shutdown.");
        }
    }

    private void checkInterval(final long intervalNanos) {
        checkInitialized();
        Requires.requireTrue(intervalNanos >= 0, "interval must not be negative: %d", intervalNanos);
        Requires.requireTrue(intervalNanos / this.granularityNanos <= SpokeLayout.MAX_TICKS,
            "interval %d ns is beyond the horizon of the wheel", intervalNanos);
    }

    private void checkInitialized() {
        if (!this.initialized) {
            throw new IllegalStateException("Timing wheel is not initialized.");
        }
    }

    private long currentTick() {
        this.readLock.lock();
        try {
            return Integer.toUnsignedLong(this.curTick);
        } finally {
            this.readLock.unlock();
        }
    }

    @Override
    public WheelMetrics getMetrics() {
        return this.metrics;
    }

    @OnlyForTest
    void advance(final long nowNanos) {
        advance(nowNanos, null);
    }

    @OnlyForTest
    int getCurTick() {
        this.readLock.lock();
        try {
            return this.curTick;
        } finally {
            this.readLock.unlock();
        }
    }

    /**
     * Id of the list holding the entry: its spoke index, {@link #DUE_NOW_ID},
     * or null when detached.
     */
    @OnlyForTest
    Integer listIdOf(final TimerEntry entry) {
        this.readLock.lock();
        try {
            final LinkedNodeList<TimerEntry> list = entry.list();
            return list == null ? null : list.id();
        } finally {
            this.readLock.unlock();
        }
    }

    @OnlyForTest
    int spokeSize(final int spoke) {
        this.readLock.lock();
        try {
            return spoke == DUE_NOW_ID ? this.doNow.size() : this.spokes[spoke].size();
        } finally {
            this.readLock.unlock();
        }
    }

    @Override
    public void describe(final Printer out) {
        final StringBuilder levels = new StringBuilder();
        final String running;
        final int dueNow;
        final long tick;
        this.readLock.lock();
        try {
            if (!this.initialized) {
                out.println("TimingWheel [uninitialized]");
                return;
            }
            running = String.valueOf(this.running);
            dueNow = this.doNow.size();
            tick = Integer.toUnsignedLong(this.curTick);
            int main = 0;
            for (int i = 0; i < SpokeLayout.MAIN_SIZE; i++) {
                main += this.spokes[i].size();
            }
            levels.append("main=").append(main);
            for (int level = 0; level < SpokeLayout.LEVELS; level++) {
                int count = 0;
                for (int i = 0; i < SpokeLayout.LEVEL_SIZE; i++) {
                    count += this.spokes[SpokeLayout.cascadeSpoke(level, i)].size();
                }
                levels.append(", level").append(level).append('=').append(count);
            }
        } finally {
            this.readLock.unlock();
        }
        out.print("TimingWheel [name=") //
            .print(this.name) //
            .print(", running=") //
            .print(running) //
            .print(", curTick=") //
            .print(tick) //
            .print(", granularityNanos=") //
            .print(this.granularityNanos) //
            .print(", dueNow=") //
            .print(dueNow) //
            .print(", ") //
            .print(levels) //
            .println("]");
    }

    @Override
    public String toString() {
        return "TimingWheelImpl [name=" + this.name + ", granularityNanos=" + this.granularityNanos
               + ", defaultIntervalNanos=" + this.defaultIntervalNanos + "]";
    }

    /**
     * Drives the wheel, wakes up at every granularity boundary.
     */
    private final class Worker implements Runnable {

        private final CountDownLatch stopLatch = new CountDownLatch(1);
        private volatile boolean     stopped;

        void stop() {
            this.stopped = true;
            this.stopLatch.countDown();
        }

        @Override
        public void run() {
            LOG.info("Worker of timing wheel {} started.", TimingWheelImpl.this.name);
            final long granularity = TimingWheelImpl.this.granularityNanos;
            long waitNanos = granularity;
            while (!this.stopped) {
                try {
                    if (this.stopLatch.await(waitNanos, TimeUnit.NANOSECONDS)) {
                        break;
                    }
                } catch (final InterruptedException e) {
                    if (this.stopped) {
                        break;
                    }
                    LOG.warn("Worker of timing wheel {} is interrupted, keep ticking.", TimingWheelImpl.this.name);
                }
                advance(TimingWheelImpl.this.clock.nanoTime(), this);
                // sleep to the next boundary to avoid drift
                waitNanos = granularity - Math.floorMod(TimingWheelImpl.this.clock.nanoTime(), granularity);
            }
            LOG.info("Worker of timing wheel {} stopped.", TimingWheelImpl.this.name);
        }
    }
}

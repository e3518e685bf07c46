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
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import com.alipay.sofa.timing.TimingServiceFactory;
import com.alipay.sofa.timing.TimingWheel;
import com.alipay.sofa.timing.entity.TimerEntry;
import com.alipay.sofa.timing.job.SynchronizedJob;
import com.alipay.sofa.timing.option.TimingWheelOptions;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

/**
 * Runs the worker thread against the system clock.
 */
public class TimingWheelRunTest {

    private TimingWheel wheel;

    @Before
    public void setup() {
        final TimingWheelOptions opts = new TimingWheelOptions();
        opts.setName("run-test-wheel");
        opts.setGranularityMs(10);
        opts.setDefaultIntervalMs(50);
        this.wheel = TimingServiceFactory.createWheel(opts);
    }

    @After
    public void teardown() {
        this.wheel.shutdown();
    }

    @Test
    public void testRunAndCloseAreIdempotent() {
        assertFalse(this.wheel.isRunning());
        this.wheel.close();
        assertFalse(this.wheel.isRunning());

        assertSame(this.wheel, this.wheel.run());
        assertTrue(this.wheel.isRunning());
        this.wheel.run();
        assertTrue(this.wheel.isRunning());

        this.wheel.close();
        assertFalse(this.wheel.isRunning());
        this.wheel.close();
        assertFalse(this.wheel.isRunning());
    }

    @Test
    public void testOneShotAndBoundedJobsFire() throws Exception {
        this.wheel.run();
        final SynchronizedJob oneShot = new SynchronizedJob();
        final SynchronizedJob bounded = new SynchronizedJob(3);
        this.wheel.addOneShotJob(oneShot, 30, TimeUnit.MILLISECONDS);
        this.wheel.addJob(bounded, 3, 20, TimeUnit.MILLISECONDS);

        assertTrue(oneShot.await(5, TimeUnit.SECONDS));
        assertTrue(bounded.await(5, TimeUnit.SECONDS));

        Thread.sleep(200);
        assertEquals(1, oneShot.getFiredCount());
        assertEquals(3, bounded.getFiredCount());
        assertEquals(0, this.wheel.size());
    }

    @Test
    public void testPersistJobUntilDeleted() throws Exception {
        this.wheel.run();
        final SynchronizedJob job = new SynchronizedJob(5);
        final TimerEntry entry = this.wheel.addPersistJob(job, 10, TimeUnit.MILLISECONDS);

        assertTrue(job.await(5, TimeUnit.SECONDS));
        assertTrue(this.wheel.delete(entry));
        final int fired = job.getFiredCount();
        Thread.sleep(100);
        assertEquals(fired, job.getFiredCount());
        assertEquals(0, this.wheel.size());
    }

    @Test
    public void testCloseKeepsPendingEntries() throws Exception {
        this.wheel.run();
        final SynchronizedJob job = new SynchronizedJob();
        this.wheel.addOneShotJob(job, 100, TimeUnit.MILLISECONDS);
        this.wheel.close();

        assertFalse(job.await(300, TimeUnit.MILLISECONDS));
        assertEquals(1, this.wheel.size());

        // a restarted worker catches up on the missed ticks
        this.wheel.run();
        assertTrue(job.await(5, TimeUnit.SECONDS));
        assertEquals(0, this.wheel.size());
    }

    @Test
    public void testCloseFromInsideJob() throws Exception {
        this.wheel.run();
        final SynchronizedJob after = new SynchronizedJob();
        final CountDownLatch closed = new CountDownLatch(1);
        this.wheel.addOneShotJobFunc(() -> {
            this.wheel.close();
            closed.countDown();
        }, 20, TimeUnit.MILLISECONDS);
        this.wheel.addOneShotJob(after, 200, TimeUnit.MILLISECONDS);

        assertTrue(closed.await(5, TimeUnit.SECONDS));
        assertFalse(this.wheel.isRunning());
        assertFalse(after.await(400, TimeUnit.MILLISECONDS));
    }

    @Test
    public void testRestartedWorkerWaitsForRunningJob() throws Exception {
        this.wheel.run();
        final AtomicInteger inFlight = new AtomicInteger();
        final AtomicInteger maxInFlight = new AtomicInteger();
        final CountDownLatch slowEntered = new CountDownLatch(1);
        this.wheel.addOneShotJobFunc(() -> runTracked(inFlight, maxInFlight, () -> {
            slowEntered.countDown();
            sleepQuietly(500);
        }), 10, TimeUnit.MILLISECONDS);

        assertTrue(slowEntered.await(5, TimeUnit.SECONDS));
        // the old worker is still inside the slow job
        this.wheel.close();
        this.wheel.run();
        final SynchronizedJob fast = new SynchronizedJob();
        this.wheel.addOneShotJobFunc(() -> runTracked(inFlight, maxInFlight, fast::run), 10, TimeUnit.MILLISECONDS);

        assertTrue(fast.await(5, TimeUnit.SECONDS));
        assertEquals(1, maxInFlight.get());
    }

    @Test
    public void testSlowJobDoesNotBlockCallers() throws Exception {
        this.wheel.run();
        final CountDownLatch entered = new CountDownLatch(1);
        final CountDownLatch release = new CountDownLatch(1);
        this.wheel.addOneShotJobFunc(() -> {
            entered.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, 10, TimeUnit.MILLISECONDS);

        assertTrue(entered.await(5, TimeUnit.SECONDS));
        // the worker is inside the job, the wheel must stay usable
        final TimerEntry entry = this.wheel.addOneShotJob(new SynchronizedJob(), 10, TimeUnit.SECONDS);
        assertEquals(1, this.wheel.size());
        assertTrue(this.wheel.delete(entry));
        assertTrue(this.wheel.isRunning());
        release.countDown();
    }

    @Test
    public void testFailingJobKeepsWorkerAlive() throws Exception {
        this.wheel.run();
        final AtomicInteger failures = new AtomicInteger();
        this.wheel.addPersistJobFunc(() -> {
            failures.incrementAndGet();
            throw new IllegalStateException("boom");
        }, 10, TimeUnit.MILLISECONDS);
        final SynchronizedJob job = new SynchronizedJob(3);
        this.wheel.addJob(job, 3, 30, TimeUnit.MILLISECONDS);

        assertTrue(job.await(5, TimeUnit.SECONDS));
        assertTrue(failures.get() > 0);
        assertTrue(this.wheel.isRunning());
    }

    private static void runTracked(final AtomicInteger inFlight, final AtomicInteger maxInFlight, final Runnable body) {
        maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
        try {
            body.run();
        } finally {
            inFlight.decrementAndGet();
        }
    }

    private static void sleepQuietly(final long ms) {
        try {
            Thread.sleep(ms);
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}

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

import org.junit.Test;

import com.alipay.sofa.timing.entity.TimerEntry;
import com.alipay.sofa.timing.job.SynchronizedJob;
import com.alipay.sofa.timing.option.TimingWheelOptions;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class TimingServiceFactoryTest {

    @Test
    public void testCreateWithDefaults() {
        final TimingWheel wheel = TimingServiceFactory.createWheel();
        try {
            assertFalse(wheel.isRunning());
            final TimerEntry entry = wheel.addOneShotJob(new SynchronizedJob());
            assertEquals(TimeUnit.MILLISECONDS.toNanos(TimingWheelOptions.DEFAULT_INTERVAL_MS),
                entry.getIntervalNanos());
            assertEquals(1, wheel.size());
        } finally {
            wheel.shutdown();
        }
    }

    @Test
    public void testCreateWithGranularityAndInterval() {
        final TimingWheel wheel = TimingServiceFactory.createWheel(5, 20);
        try {
            final TimerEntry entry = wheel.newJob(new SynchronizedJob(), TimerEntry.PERSIST);
            assertEquals(TimeUnit.MILLISECONDS.toNanos(20), entry.getIntervalNanos());
            assertFalse(entry.isLinked());
            assertEquals(0, wheel.size());
        } finally {
            wheel.shutdown();
        }
    }

    @Test(expected = IllegalStateException.class)
    public void testCreateWithBadOptions() {
        TimingServiceFactory.createWheel(-1);
    }

    @Test
    public void testCreateAndRun() throws Exception {
        final TimingWheelOptions opts = new TimingWheelOptions();
        opts.setGranularityMs(10);
        final TimingWheel wheel = TimingServiceFactory.createAndRunWheel(opts);
        try {
            assertTrue(wheel.isRunning());
            final SynchronizedJob job = new SynchronizedJob();
            wheel.addOneShotJobFunc(job::run, 20, TimeUnit.MILLISECONDS);
            assertTrue(job.await(5, TimeUnit.SECONDS));
        } finally {
            wheel.shutdown();
        }
        assertFalse(wheel.isRunning());
    }

    @Test
    public void testDeleteAfterShutdownIsSafe() {
        final TimingWheel wheel = TimingServiceFactory.createWheel(10);
        final TimerEntry entry = wheel.addOneShotJob(new SynchronizedJob(), 1, TimeUnit.SECONDS);
        wheel.shutdown();
        assertTrue(wheel.delete(entry));
        assertFalse(wheel.delete(entry));
    }
}

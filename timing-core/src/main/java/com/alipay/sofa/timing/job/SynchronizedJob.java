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
package com.alipay.sofa.timing.job;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import com.alipay.sofa.timing.Job;

/**
 * A special Job which provides synchronization primitives, callers can wait
 * until it has fired a given number of times.
 */
public class SynchronizedJob implements Job {

    private final AtomicInteger     fired = new AtomicInteger();
    private volatile CountDownLatch latch;
    /**
     * Latch count to reset
     */
    private final int               count;

    public SynchronizedJob() {
        this(1);
    }

    public SynchronizedJob(final int n) {
        this.count = n;
        this.latch = new CountDownLatch(n);
    }

    /**
     * Times this job has run since creation.
     */
    public int getFiredCount() {
        return this.fired.get();
    }

    @Override
    public void run() {
        this.fired.incrementAndGet();
        this.latch.countDown();
    }

    /**
     * Wait until the job has run {@code n} times.
     *
     * @throws InterruptedException if the current thread is interrupted
     *                              while waiting
     */
    public void await() throws InterruptedException {
        this.latch.await();
    }

    /**
     * Wait until the job has run {@code n} times or the timeout elapses.
     *
     * @return false if the timeout elapsed first
     * @throws InterruptedException if the current thread is interrupted
     *                              while waiting
     */
    public boolean await(final long timeout, final TimeUnit unit) throws InterruptedException {
        return this.latch.await(timeout, unit);
    }

    /**
     * Reset the latch, the fired counter keeps counting.
     */
    public void reset() {
        this.latch = new CountDownLatch(this.count);
    }
}

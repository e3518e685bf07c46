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

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.Test;

import com.alipay.sofa.timing.Job;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class SynchronizedJobTest {

    @Test
    public void testAwait() throws Exception {
        final SynchronizedJob job = new SynchronizedJob(2);
        job.run();
        assertFalse(job.await(10, TimeUnit.MILLISECONDS));
        new Thread(job::run).start();
        assertTrue(job.await(5, TimeUnit.SECONDS));
        assertEquals(2, job.getFiredCount());

        job.reset();
        assertFalse(job.await(10, TimeUnit.MILLISECONDS));
        assertEquals(2, job.getFiredCount());
    }

    @Test
    public void testFuncJob() {
        final AtomicInteger counter = new AtomicInteger();
        final Job job = FuncJob.of(counter::incrementAndGet);
        job.run();
        job.run();
        assertEquals(2, counter.get());
    }

    @Test(expected = NullPointerException.class)
    public void testFuncJobNull() {
        FuncJob.of(null);
    }
}

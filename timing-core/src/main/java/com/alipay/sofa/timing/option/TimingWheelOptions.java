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
package com.alipay.sofa.timing.option;

import java.util.concurrent.Executor;

import com.alipay.sofa.timing.util.Clock;
import com.alipay.sofa.timing.util.SystemPropertyUtil;

/**
 * Timing wheel options.
 */
public class TimingWheelOptions {

    public static final long DEFAULT_GRANULARITY_MS = SystemPropertyUtil.getLong("timing.wheel.granularity_ms",
                                                        100);
    public static final long DEFAULT_INTERVAL_MS    = SystemPropertyUtil.getLong(
                                                        "timing.wheel.default_interval_ms", 1000);

    // Wall clock duration of one tick
    private long             granularityMs          = DEFAULT_GRANULARITY_MS;

    // Interval used when a job is added without one
    private long             defaultIntervalMs      = DEFAULT_INTERVAL_MS;

    // Used in the worker thread name and in logs
    private String           name                   = "timing-wheel";

    private boolean          daemon                 = true;

    private Clock            clock                  = Clock.SYSTEM;

    // Due jobs are handed to this executor instead of running on the worker when set
    private Executor         jobExecutor;

    private boolean          enableMetrics          = false;

    public long getGranularityMs() {
        return this.granularityMs;
    }

    public void setGranularityMs(final long granularityMs) {
        this.granularityMs = granularityMs;
    }

    public long getDefaultIntervalMs() {
        return this.defaultIntervalMs;
    }

    public void setDefaultIntervalMs(final long defaultIntervalMs) {
        this.defaultIntervalMs = defaultIntervalMs;
    }

    public String getName() {
        return this.name;
    }

    public void setName(final String name) {
        this.name = name;
    }

    public boolean isDaemon() {
        return this.daemon;
    }

    public void setDaemon(final boolean daemon) {
        this.daemon = daemon;
    }

    public Clock getClock() {
        return this.clock;
    }

    public void setClock(final Clock clock) {
        this.clock = clock;
    }

    public Executor getJobExecutor() {
        return this.jobExecutor;
    }

    public void setJobExecutor(final Executor jobExecutor) {
        this.jobExecutor = jobExecutor;
    }

    public boolean isEnableMetrics() {
        return this.enableMetrics;
    }

    public void setEnableMetrics(final boolean enableMetrics) {
        this.enableMetrics = enableMetrics;
    }

    public TimingWheelOptions copy() {
        final TimingWheelOptions opts = new TimingWheelOptions();
        opts.setGranularityMs(this.granularityMs);
        opts.setDefaultIntervalMs(this.defaultIntervalMs);
        opts.setName(this.name);
        opts.setDaemon(this.daemon);
        opts.setClock(this.clock);
        opts.setJobExecutor(this.jobExecutor);
        opts.setEnableMetrics(this.enableMetrics);
        return opts;
    }

    @Override
    public String toString() {
        return "TimingWheelOptions{" + "granularityMs=" + this.granularityMs + ", defaultIntervalMs="
               + this.defaultIntervalMs + ", name='" + this.name + '\'' + ", daemon=" + this.daemon + ", clock="
               + this.clock + ", jobExecutor=" + this.jobExecutor + ", enableMetrics=" + this.enableMetrics + '}';
    }
}

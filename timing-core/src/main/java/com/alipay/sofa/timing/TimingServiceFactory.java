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

import com.alipay.sofa.timing.core.TimingWheelImpl;
import com.alipay.sofa.timing.option.TimingWheelOptions;

/**
 * Service factory to create timing services, such as TimingWheel etc.
 */
public final class TimingServiceFactory {

    /**
     * Create a timing wheel with the default granularity and default interval.
     */
    public static TimingWheel createWheel() {
        return createWheel(new TimingWheelOptions());
    }

    /**
     * Create a timing wheel with the given tick duration.
     *
     * @param granularityMs duration of one tick in milliseconds
     */
    public static TimingWheel createWheel(final long granularityMs) {
        final TimingWheelOptions opts = new TimingWheelOptions();
        opts.setGranularityMs(granularityMs);
        return createWheel(opts);
    }

    /**
     * Create a timing wheel with the given tick duration and default interval.
     *
     * @param granularityMs     duration of one tick in milliseconds
     * @param defaultIntervalMs interval of jobs added without one
     */
    public static TimingWheel createWheel(final long granularityMs, final long defaultIntervalMs) {
        final TimingWheelOptions opts = new TimingWheelOptions();
        opts.setGranularityMs(granularityMs);
        opts.setDefaultIntervalMs(defaultIntervalMs);
        return createWheel(opts);
    }

    /**
     * Create and initialize a timing wheel, the worker is not started.
     *
     * @param opts wheel options
     * @return the wheel
     * @throws IllegalStateException if the options are rejected
     */
    public static TimingWheel createWheel(final TimingWheelOptions opts) {
        final TimingWheel ret = new TimingWheelImpl();
        if (!ret.init(opts)) {
            throw new IllegalStateException("Fail to init timing wheel, please see the logs to find the reason.");
        }
        return ret;
    }

    /**
     * Create, initialize and run a timing wheel.
     */
    public static TimingWheel createAndRunWheel(final TimingWheelOptions opts) {
        return createWheel(opts).run();
    }

    private TimingServiceFactory() {
    }
}

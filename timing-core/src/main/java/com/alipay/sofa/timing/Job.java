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

/**
 * A unit of work fired by a {@link TimingWheel}.
 *
 * <p>Jobs run on the wheel's driver thread one at a time, so a slow job delays
 * every job due after it and the advance of the wheel itself. Jobs that need
 * more than a few microseconds should hand their work to an executor.
 */
@FunctionalInterface
public interface Job {

    /**
     * Called when the timer entry holding this job is due.
     */
    void run();
}

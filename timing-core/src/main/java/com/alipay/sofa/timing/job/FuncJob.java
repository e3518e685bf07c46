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

import com.alipay.sofa.timing.Job;
import com.alipay.sofa.timing.util.Requires;

/**
 * Adapts a plain {@link Runnable} to a {@link Job}.
 */
public final class FuncJob implements Job {

    private final Runnable func;

    public FuncJob(final Runnable func) {
        this.func = Requires.requireNonNull(func, "func");
    }

    public static Job of(final Runnable func) {
        return new FuncJob(func);
    }

    @Override
    public void run() {
        this.func.run();
    }

    @Override
    public String toString() {
        return "FuncJob [func=" + this.func + "]";
    }
}

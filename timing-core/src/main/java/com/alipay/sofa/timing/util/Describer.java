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
package com.alipay.sofa.timing.util;

/**
 * Components that can print their internal state.
 */
public interface Describer {

    void describe(final Printer out);

    interface Printer {

        /**
         * Prints an object.
         * @param x The <code>Object</code> to be printed
         * @return this printer
         */
        Printer print(final Object x);

        /**
         * Prints an Object and then terminates the line.
         *
         * @param x The <code>Object</code> to be printed.
         * @return this printer
         */
        Printer println(final Object x);
    }

    class DefaultPrinter implements Printer {

        private final StringBuilder buf = new StringBuilder(256);

        @Override
        public Printer print(final Object x) {
            this.buf.append(x);
            return this;
        }

        @Override
        public Printer println(final Object x) {
            this.buf.append(x).append(System.lineSeparator());
            return this;
        }

        @Override
        public String toString() {
            return this.buf.toString();
        }
    }
}

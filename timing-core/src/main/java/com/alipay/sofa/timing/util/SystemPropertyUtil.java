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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A collection of utility methods to retrieve and parse the values of the Java system properties.
 */
public final class SystemPropertyUtil {

    private static final Logger LOG = LoggerFactory.getLogger(SystemPropertyUtil.class);

    /**
     * Returns the value of the Java system property with the specified
     * {@code key}, while falling back to the specified default value if
     * the property access fails.
     *
     * @return the property value.
     * {@code def} if there's no such property or if an access to the
     * specified property is not allowed.
     */
    public static String get(final String key, final String def) {
        Requires.requireNonNull(key, "key");
        Requires.requireTrue(!key.isEmpty(), "key must not be empty.");

        String value = null;
        try {
            value = System.getProperty(key);
        } catch (final SecurityException e) {
            LOG.warn("Unable to retrieve a system property '{}'; default values will be used, {}.", key, e);
        }

        if (value == null) {
            return def;
        }
        return value;
    }

    /**
     * Returns the value of the Java system property with the specified
     * {@code key}, while falling back to the specified default value if
     * the property access fails.
     *
     * @return the property value or {@code def}
     */
    public static long getLong(final String key, final long def) {
        String value = get(key, null);
        if (value == null) {
            return def;
        }

        value = value.trim();
        try {
            return Long.parseLong(value);
        } catch (final NumberFormatException e) {
            LOG.warn("Unable to parse the long integer system property '{}':{} - using the default value: {}.", key,
                value, def);
            return def;
        }
    }

    private SystemPropertyUtil() {
    }
}

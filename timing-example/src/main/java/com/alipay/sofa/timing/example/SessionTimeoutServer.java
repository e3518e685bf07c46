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
package com.alipay.sofa.timing.example;

import java.util.Collection;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.alipay.sofa.timing.TimingServiceFactory;
import com.alipay.sofa.timing.TimingWheel;
import com.alipay.sofa.timing.entity.TimerEntry;
import com.alipay.sofa.timing.option.TimingWheelOptions;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Slf4jReporter;

/**
 * Session server that expires idle sessions with a timing wheel.
 * Every session owns a one-shot timeout entry which is re-armed on each
 * activity, so only idle sessions ever fire.
 */
public class SessionTimeoutServer {

    private static final Logger        LOG      = LoggerFactory.getLogger(SessionTimeoutServer.class);

    private final TimingWheel          wheel;
    private final long                 sessionTimeoutMs;
    private final Map<String, Session> sessions = new ConcurrentHashMap<>();
    private final AtomicLong           expired  = new AtomicLong();
    private final TimerEntry           reporter;
    private Slf4jReporter              metricsReporter;

    public SessionTimeoutServer(final TimingWheelOptions opts, final long sessionTimeoutMs, final long reportIntervalMs) {
        this.sessionTimeoutMs = sessionTimeoutMs;
        this.wheel = TimingServiceFactory.createWheel(opts);
        // a persistent job reporting live sessions
        this.reporter = this.wheel.addPersistJobFunc(
            () -> LOG.info("Live sessions: {}, expired so far: {}.", this.sessions.size(), this.expired.get()),
            reportIntervalMs, TimeUnit.MILLISECONDS);
        final MetricRegistry registry = this.wheel.getMetrics().getMetricRegistry();
        if (registry != null) {
            this.metricsReporter = Slf4jReporter.forRegistry(registry) //
                .outputTo(LOG) //
                .convertRatesTo(TimeUnit.SECONDS) //
                .convertDurationsTo(TimeUnit.MILLISECONDS) //
                .build();
        }
    }

    public void start() {
        this.wheel.run();
        if (this.metricsReporter != null) {
            this.metricsReporter.start(30, TimeUnit.SECONDS);
        }
        LOG.info("Session server started, session timeout is {} ms.", this.sessionTimeoutMs);
    }

    public void shutdown() {
        if (this.metricsReporter != null) {
            this.metricsReporter.report();
            this.metricsReporter.stop();
        }
        this.wheel.delete(this.reporter);
        this.wheel.shutdown();
        LOG.info("Session server shutdown, {} sessions still alive.", this.sessions.size());
    }

    /**
     * Open a session, returns false if the id is in use.
     */
    public boolean open(final String id) {
        final Session session = new Session(id);
        session.timeout = this.wheel.newJobFunc(() -> expire(session), TimerEntry.ONE_SHOT, this.sessionTimeoutMs,
            TimeUnit.MILLISECONDS);
        if (this.sessions.putIfAbsent(id, session) != null) {
            return false;
        }
        this.wheel.start(session.timeout);
        return true;
    }

    /**
     * Record activity on a session and push back its timeout.
     */
    public boolean touch(final String id) {
        final Session session = this.sessions.get(id);
        if (session == null) {
            return false;
        }
        session.lastActiveNanos = System.nanoTime();
        this.wheel.start(session.timeout);
        return true;
    }

    public boolean close(final String id) {
        final Session session = this.sessions.remove(id);
        if (session == null) {
            return false;
        }
        this.wheel.delete(session.timeout);
        return true;
    }

    public boolean isAlive(final String id) {
        return this.sessions.containsKey(id);
    }

    public Collection<Session> getSessions() {
        return this.sessions.values();
    }

    public long getExpiredCount() {
        return this.expired.get();
    }

    public TimingWheel getWheel() {
        return this.wheel;
    }

    private void expire(final Session session) {
        if (this.sessions.remove(session.id, session)) {
            this.expired.incrementAndGet();
            LOG.info("Session {} expired, idle for {} ms.", session.id,
                TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - session.lastActiveNanos));
        }
    }

    public static final class Session {

        private final String        id;
        private volatile long       lastActiveNanos = System.nanoTime();
        private TimerEntry    timeout;

        Session(final String id) {
            this.id = id;
        }

        public String getId() {
            return this.id;
        }

        public long getLastActiveNanos() {
            return this.lastActiveNanos;
        }
    }

    public static void main(final String[] args) throws InterruptedException {
        if (args.length > 2) {
            System.out.println("Usage : java com.alipay.sofa.timing.example.SessionTimeoutServer {sessions} {timeoutMs}");
            System.out.println("Example: java com.alipay.sofa.timing.example.SessionTimeoutServer 1000 3000");
            System.exit(1);
        }
        final int sessionCount = args.length > 0 ? Integer.parseInt(args[0]) : 1000;
        final long timeoutMs = args.length > 1 ? Long.parseLong(args[1]) : 3000;

        final TimingWheelOptions opts = new TimingWheelOptions();
        opts.setName("session-wheel");
        opts.setGranularityMs(10);
        opts.setEnableMetrics(true);
        final SessionTimeoutServer server = new SessionTimeoutServer(opts, timeoutMs, 1000);
        server.start();

        for (int i = 0; i < sessionCount; i++) {
            server.open("session-" + i);
        }
        // keep the even sessions busy for a while, odd ones go idle
        final long busyUntil = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs * 2);
        while (System.nanoTime() < busyUntil) {
            final int i = ThreadLocalRandom.current().nextInt(sessionCount / 2 + 1) * 2;
            server.touch("session-" + i);
            Thread.sleep(1);
        }
        Thread.sleep(timeoutMs * 2);
        server.shutdown();
    }
}

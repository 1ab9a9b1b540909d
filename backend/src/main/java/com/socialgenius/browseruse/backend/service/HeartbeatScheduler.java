package com.socialgenius.browseruse.backend.service;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Periodic "still running" log lines for long jobs. Each job opens a {@link Heartbeat}
 * in a try-with-resources block so it stops on every exit path.
 */
@Component
public class HeartbeatScheduler {

    private static final Logger log = LoggerFactory.getLogger(HeartbeatScheduler.class);

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "task-heartbeat");
        t.setDaemon(true);
        return t;
    });

    private final Set<Heartbeat> active = ConcurrentHashMap.newKeySet();
    private final AtomicLong totalTicks = new AtomicLong();

    public Heartbeat start(String traceId, Duration interval) {
        Heartbeat heartbeat = new Heartbeat(traceId, interval);
        active.add(heartbeat);
        long periodMillis = Math.max(1, interval.toMillis());
        heartbeat.future = scheduler.scheduleAtFixedRate(heartbeat::tick, periodMillis, periodMillis,
                TimeUnit.MILLISECONDS);
        return heartbeat;
    }

    public int activeCount() {
        return active.size();
    }

    /**
     * Ticks emitted by all heartbeats since startup.
     */
    public long totalTicks() {
        return totalTicks.get();
    }

    @PreDestroy
    void shutdown() {
        scheduler.shutdownNow();
    }

    public final class Heartbeat implements AutoCloseable {

        private final String traceId;
        private final Duration interval;
        private final AtomicInteger ticks = new AtomicInteger();
        private final AtomicBoolean stopped = new AtomicBoolean();
        private volatile ScheduledFuture<?> future;

        private Heartbeat(String traceId, Duration interval) {
            this.traceId = traceId;
            this.interval = interval;
        }

        private synchronized void tick() {
            if (stopped.get()) {
                return;
            }
            int count = ticks.incrementAndGet();
            totalTicks.incrementAndGet();
            log.info("[TRACE:{}] Authentication in progress - {} seconds elapsed", traceId,
                    interval.multipliedBy(count).toSeconds());
        }

        public int ticks() {
            return ticks.get();
        }

        @Override
        public synchronized void close() {
            if (stopped.compareAndSet(false, true)) {
                if (future != null) {
                    future.cancel(false);
                }
                active.remove(this);
                log.info("[TRACE:{}] Periodic progress logging stopped", traceId);
            }
        }
    }
}

package com.pagerwatch.service.runtime;

import com.pagerwatch.service.store.RetentionStore;
import com.pagerwatch.service.store.SnapshotFlusher;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Periodic store upkeep: retention eviction and durable flushes. Both run on one timer thread so
 * they never overlap each other; ingestion keeps appending meanwhile.
 */
public class MaintenanceScheduler {
    private static final Logger LOGGER = Logger.getLogger(MaintenanceScheduler.class.getName());

    private final RetentionStore store;
    private final SnapshotFlusher flusher;
    private final Clock clock;
    private final Duration flushInterval;
    private final Duration evictionInterval;
    private final long minIntervalMillis;
    private final ScheduledExecutorService timerExecutor = Executors.newSingleThreadScheduledExecutor(runnable -> {
        Thread thread = new Thread(runnable, "store-maintenance");
        thread.setDaemon(true);
        return thread;
    });
    private final AtomicBoolean shutdown = new AtomicBoolean();

    public MaintenanceScheduler(
            RetentionStore store,
            SnapshotFlusher flusher,
            Clock clock,
            Duration flushInterval,
            Duration evictionInterval
    ) {
        this(store, flusher, clock, flushInterval, evictionInterval, 100);
    }

    MaintenanceScheduler(
            RetentionStore store,
            SnapshotFlusher flusher,
            Clock clock,
            Duration flushInterval,
            Duration evictionInterval,
            long minIntervalMillis
    ) {
        this.store = store;
        this.flusher = flusher;
        this.clock = clock;
        this.flushInterval = flushInterval;
        this.evictionInterval = evictionInterval;
        this.minIntervalMillis = minIntervalMillis;
    }

    public void start() {
        long evictMillis = Math.max(minIntervalMillis, evictionInterval.toMillis());
        long flushMillis = Math.max(minIntervalMillis, flushInterval.toMillis());
        timerExecutor.scheduleAtFixedRate(this::runEviction, evictMillis, evictMillis, TimeUnit.MILLISECONDS);
        timerExecutor.scheduleAtFixedRate(this::runFlush, flushMillis, flushMillis, TimeUnit.MILLISECONDS);
    }

    /**
     * Stops the timer and writes the store one last time. Safe to call more than once.
     */
    public void shutdown() {
        if (!shutdown.compareAndSet(false, true)) {
            return;
        }
        timerExecutor.shutdown();
        try {
            if (!timerExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                timerExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        flusher.flushAndReport();
    }

    void runEviction() {
        try {
            int removed = store.evict(clock.instant());
            if (removed > 0) {
                LOGGER.fine(() -> "Evicted " + removed + " alerts older than " + store.retention());
            }
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Eviction run failed", e);
        }
    }

    void runFlush() {
        try {
            flusher.flushAndReport();
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Flush run failed", e);
        }
    }
}

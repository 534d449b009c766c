package com.pagerwatch.service.api;

import com.pagerwatch.core.bus.EventBus;
import com.pagerwatch.core.events.AlertIngested;
import com.pagerwatch.core.events.CapcodesReloaded;
import com.pagerwatch.core.events.LineRejected;
import com.pagerwatch.core.events.SnapshotFailed;
import com.pagerwatch.core.events.SnapshotFlushed;
import com.pagerwatch.core.events.SubscriberDropped;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayDeque;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.IntSupplier;

public final class DiagnosticsTracker {
    private final Clock clock;
    private final IntSupplier subscriberCountSupplier;
    private final IntSupplier storedAlertsSupplier;
    private final LongAdder alertsIngested = new LongAdder();
    private final LongAdder linesRejected = new LongAdder();
    private final LongAdder liveDrops = new LongAdder();
    private final LongAdder flushFailures = new LongAdder();
    private final ArrayDeque<Instant> recentAlerts = new ArrayDeque<>();
    private final Object recentLock = new Object();
    private final AtomicReference<SnapshotFlushed> lastFlush = new AtomicReference<>();
    private final AtomicReference<SnapshotFailed> lastFlushError = new AtomicReference<>();
    private final AtomicReference<LineRejected> lastRejected = new AtomicReference<>();
    private final AtomicReference<CapcodesReloaded> lastCapcodeLoad = new AtomicReference<>();

    public DiagnosticsTracker(EventBus eventBus, Clock clock, IntSupplier subscriberCountSupplier, IntSupplier storedAlertsSupplier) {
        this(clock, subscriberCountSupplier, storedAlertsSupplier);
        eventBus.subscribe(AlertIngested.class, this::onAlertIngested);
        eventBus.subscribe(LineRejected.class, this::onLineRejected);
        eventBus.subscribe(SubscriberDropped.class, event -> liveDrops.increment());
        eventBus.subscribe(SnapshotFlushed.class, lastFlush::set);
        eventBus.subscribe(SnapshotFailed.class, this::onSnapshotFailed);
        eventBus.subscribe(CapcodesReloaded.class, lastCapcodeLoad::set);
    }

    private DiagnosticsTracker(Clock clock, IntSupplier subscriberCountSupplier, IntSupplier storedAlertsSupplier) {
        this.clock = clock;
        this.subscriberCountSupplier = subscriberCountSupplier;
        this.storedAlertsSupplier = storedAlertsSupplier;
    }

    public static DiagnosticsTracker empty() {
        return new DiagnosticsTracker(Clock.systemUTC(), () -> 0, () -> 0);
    }

    public Map<String, Object> metricsSnapshot() {
        Map<String, Object> metrics = new HashMap<>();
        metrics.put("subscribersConnected", subscriberCountSupplier.getAsInt());
        metrics.put("alertsStored", storedAlertsSupplier.getAsInt());
        metrics.put("alertsIngestedTotal", alertsIngested.longValue());
        metrics.put("alertsPerMinute", recentAlertsPerMinute());
        metrics.put("linesRejectedTotal", linesRejected.longValue());
        metrics.put("liveDropsTotal", liveDrops.longValue());
        metrics.put("flushFailuresTotal", flushFailures.longValue());
        metrics.put("persistence", persistenceSnapshot());
        metrics.put("capcodes", capcodeSnapshot());
        LineRejected rejected = lastRejected.get();
        if (rejected != null) {
            metrics.put("lastRejectedReason", rejected.reason());
        }
        return metrics;
    }

    private Map<String, Object> persistenceSnapshot() {
        Map<String, Object> persistence = new HashMap<>();
        SnapshotFlushed flushed = lastFlush.get();
        SnapshotFailed failed = lastFlushError.get();
        persistence.put("lastFlushAt", flushed == null ? null : flushed.timestamp().toString());
        persistence.put("lastFlushAlerts", flushed == null ? null : flushed.alertCount());
        persistence.put("lastFlushMillis", flushed == null ? null : flushed.durationMillis());
        boolean failing = failed != null && (flushed == null || failed.timestamp().isAfter(flushed.timestamp()));
        persistence.put("lastErrorMessage", failing ? failed.message() : null);
        return persistence;
    }

    private Map<String, Object> capcodeSnapshot() {
        Map<String, Object> capcodes = new HashMap<>();
        CapcodesReloaded loaded = lastCapcodeLoad.get();
        capcodes.put("source", loaded == null ? null : loaded.source());
        capcodes.put("records", loaded == null ? 0 : loaded.recordCount());
        capcodes.put("skippedRows", loaded == null ? 0 : loaded.skippedRows());
        capcodes.put("loadedAt", loaded == null ? null : loaded.timestamp().toString());
        return capcodes;
    }

    private void onAlertIngested(AlertIngested event) {
        alertsIngested.increment();
        Instant now = clock.instant();
        synchronized (recentLock) {
            recentAlerts.addLast(now);
            trimOld(now);
        }
    }

    private void onLineRejected(LineRejected event) {
        linesRejected.increment();
        lastRejected.set(event);
    }

    private void onSnapshotFailed(SnapshotFailed event) {
        flushFailures.increment();
        lastFlushError.set(event);
    }

    private int recentAlertsPerMinute() {
        synchronized (recentLock) {
            trimOld(clock.instant());
            return recentAlerts.size();
        }
    }

    private void trimOld(Instant now) {
        Instant threshold = now.minus(1, ChronoUnit.MINUTES);
        while (!recentAlerts.isEmpty()) {
            Instant first = recentAlerts.peekFirst();
            if (first != null && first.isBefore(threshold)) {
                recentAlerts.removeFirst();
            } else {
                break;
            }
        }
    }
}

package com.pagerwatch.service.store;

import com.pagerwatch.core.bus.EventBus;
import com.pagerwatch.core.error.StoreIoException;
import com.pagerwatch.core.events.SnapshotFailed;
import com.pagerwatch.core.events.SnapshotFlushed;
import com.pagerwatch.service.support.MutableClock;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static com.pagerwatch.service.support.TestAlerts.alert;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SnapshotFlusherTest {
    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @TempDir
    Path tempDir;

    @Test
    void flushWritesOnlyWhenStoreChanged() {
        MutableClock clock = new MutableClock(NOW);
        EventBus eventBus = new EventBus();
        List<SnapshotFlushed> flushed = new CopyOnWriteArrayList<>();
        eventBus.subscribe(SnapshotFlushed.class, flushed::add);
        RetentionStore store = new RetentionStore(clock, Duration.ofDays(3));
        SnapshotFile file = new SnapshotFile(tempDir.resolve("history.json"));
        SnapshotFlusher flusher = new SnapshotFlusher(store, file, eventBus, clock);

        store.append(alert(NOW, "one"));
        assertTrue(flusher.flush());
        assertFalse(flusher.flush());

        store.append(alert(NOW, "two"));
        assertTrue(flusher.flush());

        assertEquals(2, flushed.size());
        assertEquals(2, flushed.get(1).alertCount());
        assertEquals(2, flushed.get(1).highWaterMark());
        assertEquals(2, file.read().orElseThrow().alerts().size());
    }

    @Test
    void failedFlushIsReportedAndRetriedOnNextCall() throws Exception {
        MutableClock clock = new MutableClock(NOW);
        EventBus eventBus = new EventBus();
        List<SnapshotFailed> failures = new CopyOnWriteArrayList<>();
        eventBus.subscribe(SnapshotFailed.class, failures::add);
        RetentionStore store = new RetentionStore(clock, Duration.ofDays(3));
        Path stateDir = tempDir.resolve("state");
        Files.writeString(stateDir, "a file where the directory should be");
        SnapshotFlusher flusher = new SnapshotFlusher(store, new SnapshotFile(stateDir.resolve("history.json")), eventBus, clock);

        store.append(alert(NOW, "kept in memory"));
        flusher.flushAndReport();

        assertEquals(1, failures.size());
        assertEquals(1, store.size());
        assertThrows(StoreIoException.class, flusher::flush);

        Files.delete(stateDir);
        assertTrue(flusher.flush());
        assertEquals(1, new SnapshotFile(stateDir.resolve("history.json")).read().orElseThrow().alerts().size());
    }
}

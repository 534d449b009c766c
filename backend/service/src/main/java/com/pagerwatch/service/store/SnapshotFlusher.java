package com.pagerwatch.service.store;

import com.pagerwatch.core.bus.EventBus;
import com.pagerwatch.core.error.StoreIoException;
import com.pagerwatch.core.events.SnapshotFailed;
import com.pagerwatch.core.events.SnapshotFlushed;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Writes the store to disk when it changed since the last successful write. A failed write
 * leaves the store authoritative and is retried on the next call.
 */
public class SnapshotFlusher {
    private static final Logger LOGGER = Logger.getLogger(SnapshotFlusher.class.getName());

    private final RetentionStore store;
    private final SnapshotFile file;
    private final EventBus eventBus;
    private final Clock clock;
    private final Object flushLock = new Object();
    private long flushedMutations = -1;

    public SnapshotFlusher(RetentionStore store, SnapshotFile file, EventBus eventBus, Clock clock) {
        this.store = store;
        this.file = file;
        this.eventBus = eventBus;
        this.clock = clock;
    }

    /**
     * @return {@code true} when a write happened
     * @throws StoreIoException when the write failed
     */
    public boolean flush() {
        synchronized (flushLock) {
            RetentionStore.StoreSnapshot snapshot = store.snapshot();
            if (snapshot.mutationCount() == flushedMutations) {
                return false;
            }
            Instant started = clock.instant();
            file.write(snapshot.document());
            flushedMutations = snapshot.mutationCount();
            eventBus.publish(new SnapshotFlushed(
                    clock.instant(),
                    snapshot.document().alerts().size(),
                    snapshot.document().highWaterMark(),
                    Duration.between(started, clock.instant()).toMillis()
            ));
            return true;
        }
    }

    public void flushAndReport() {
        try {
            flush();
        } catch (StoreIoException e) {
            LOGGER.log(Level.WARNING, "Alert history flush failed; retrying next interval", e);
            eventBus.publish(new SnapshotFailed(clock.instant(), e.getMessage()));
        }
    }
}

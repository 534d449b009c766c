package com.pagerwatch.service.store;

import com.pagerwatch.core.model.Alert;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.NavigableMap;
import java.util.NavigableSet;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Predicate;
import java.util.logging.Logger;

/**
 * In-memory alert history ordered by id with a secondary timestamp index for eviction.
 * <p>
 * Ids follow arrival order; timestamps come from the decoder and may run slightly backwards,
 * which only affects which alerts the time index evicts first. Append and evict take the write
 * lock, queries share the read lock. Persistence is handled by {@link SnapshotFlusher} from a
 * {@link #snapshot()} copy, never under the lock.
 */
public class RetentionStore implements AlertStore {
    private static final Logger LOGGER = Logger.getLogger(RetentionStore.class.getName());

    private final Clock clock;
    private final Duration retention;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final NavigableMap<Long, Alert> byId = new TreeMap<>();
    private final NavigableSet<TimeKey> byTime = new TreeSet<>();
    private long highWaterMark;
    private long mutations;

    public RetentionStore(Clock clock, Duration retention) {
        this.clock = clock;
        this.retention = retention;
    }

    /**
     * Rebuilds a store from a persisted snapshot and drops whatever already fell out of the
     * retention window. The id high-water mark never goes below the largest persisted id.
     */
    public static RetentionStore restore(Clock clock, Duration retention, Optional<SnapshotDocument> document) {
        RetentionStore store = new RetentionStore(clock, retention);
        document.ifPresent(store::load);
        int evicted = store.evict(clock.instant());
        LOGGER.info("Restored " + store.size() + " alerts (" + evicted + " expired), next id " + (store.highWaterMark() + 1));
        return store;
    }

    private void load(SnapshotDocument document) {
        lock.writeLock().lock();
        try {
            long maxId = document.highWaterMark();
            for (Alert alert : document.alerts()) {
                if (alert.id() <= Alert.UNASSIGNED_ID || byId.containsKey(alert.id())) {
                    LOGGER.warning("Ignoring persisted alert with unusable id " + alert.id());
                    continue;
                }
                byId.put(alert.id(), alert);
                byTime.add(new TimeKey(alert.timestamp(), alert.id()));
                maxId = Math.max(maxId, alert.id());
            }
            highWaterMark = Math.max(highWaterMark, maxId);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Alert append(Alert alert) {
        lock.writeLock().lock();
        try {
            Alert stored = alert.withId(++highWaterMark);
            byId.put(stored.id(), stored);
            byTime.add(new TimeKey(stored.timestamp(), stored.id()));
            mutations++;
            return stored;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<Alert> query(Predicate<Alert> filter, Optional<Duration> maxAge, int limit) {
        Optional<Instant> cutoff = maxAge.flatMap(age -> cutoff(clock.instant(), age));
        int cap = Math.max(0, limit);
        lock.readLock().lock();
        try {
            List<Alert> matches = new ArrayList<>();
            for (Alert alert : byId.descendingMap().values()) {
                if (matches.size() >= cap) {
                    break;
                }
                if (cutoff.isPresent() && alert.timestamp().isBefore(cutoff.get())) {
                    continue;
                }
                if (filter.test(alert)) {
                    matches.add(alert);
                }
            }
            return matches;
        } finally {
            lock.readLock().unlock();
        }
    }

    // An age reaching past Instant.MIN excludes nothing.
    private static Optional<Instant> cutoff(Instant now, Duration age) {
        if (age.compareTo(Duration.between(Instant.MIN, now)) >= 0) {
            return Optional.empty();
        }
        return Optional.of(now.minus(age));
    }

    /**
     * Removes every alert whose timestamp is strictly before {@code now - retention}.
     */
    @Override
    public int evict(Instant now) {
        TimeKey boundary = new TimeKey(now.minus(retention), Long.MIN_VALUE);
        lock.writeLock().lock();
        try {
            NavigableSet<TimeKey> expired = byTime.headSet(boundary, false);
            int count = expired.size();
            for (TimeKey key : expired) {
                byId.remove(key.id());
            }
            expired.clear();
            if (count > 0) {
                mutations++;
            }
            return count;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public long highWaterMark() {
        lock.readLock().lock();
        try {
            return highWaterMark;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public int size() {
        lock.readLock().lock();
        try {
            return byId.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public Duration retention() {
        return retention;
    }

    /**
     * Consistent copy of the history for persistence, oldest first.
     */
    public StoreSnapshot snapshot() {
        lock.readLock().lock();
        try {
            return new StoreSnapshot(
                    new SnapshotDocument(SnapshotDocument.CURRENT_VERSION, highWaterMark, new ArrayList<>(byId.values())),
                    mutations
            );
        } finally {
            lock.readLock().unlock();
        }
    }

    public record StoreSnapshot(SnapshotDocument document, long mutationCount) {
    }

    private record TimeKey(Instant timestamp, long id) implements Comparable<TimeKey> {
        @Override
        public int compareTo(TimeKey other) {
            int byTimestamp = timestamp.compareTo(other.timestamp);
            return byTimestamp != 0 ? byTimestamp : Long.compare(id, other.id);
        }
    }
}

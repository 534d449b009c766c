package com.pagerwatch.service.hub;

import com.pagerwatch.core.model.Alert;
import com.pagerwatch.core.model.AlertFilter;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One live viewer: a fixed filter plus a bounded queue of pending alerts. When the queue is full
 * the oldest pending alert is discarded, so a viewer that stops reading sees the most recent
 * {@code capacity} matches and gaps before them.
 */
public final class Subscriber {
    private final long id;
    private final AlertFilter filter;
    private final int capacity;
    private final ArrayDeque<Alert> queue;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private volatile SubscriberState state = SubscriberState.ACTIVE;
    private long delivered;
    private long dropped;
    private long skipThroughId;

    Subscriber(long id, AlertFilter filter, int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.id = id;
        this.filter = filter;
        this.capacity = capacity;
        this.queue = new ArrayDeque<>(Math.min(capacity, 64));
    }

    public long id() {
        return id;
    }

    public AlertFilter filter() {
        return filter;
    }

    public int capacity() {
        return capacity;
    }

    public SubscriberState state() {
        return state;
    }

    /**
     * Enqueues without blocking.
     *
     * @return the alert discarded to make room, if any
     */
    Optional<Alert> offer(Alert alert) {
        lock.lock();
        try {
            if (state != SubscriberState.ACTIVE || alert.id() <= skipThroughId) {
                return Optional.empty();
            }
            Alert evicted = null;
            if (queue.size() >= capacity) {
                evicted = queue.pollFirst();
                dropped++;
            }
            queue.addLast(alert);
            notEmpty.signal();
            return Optional.ofNullable(evicted);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Forgets queued alerts already covered by the initial snapshot.
     */
    void skipThrough(long alertId) {
        lock.lock();
        try {
            skipThroughId = Math.max(skipThroughId, alertId);
            queue.removeIf(queued -> queued.id() <= skipThroughId);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Waits up to {@code timeout} for the next alert. Returns empty on timeout or once closed.
     */
    public Optional<Alert> poll(Duration timeout) throws InterruptedException {
        long remaining = timeout.toNanos();
        lock.lockInterruptibly();
        try {
            while (queue.isEmpty()) {
                if (state != SubscriberState.ACTIVE || remaining <= 0) {
                    return Optional.empty();
                }
                remaining = notEmpty.awaitNanos(remaining);
            }
            delivered++;
            return Optional.of(queue.pollFirst());
        } finally {
            lock.unlock();
        }
    }

    public List<Alert> drain() {
        lock.lock();
        try {
            List<Alert> pending = new ArrayList<>(queue);
            delivered += pending.size();
            queue.clear();
            return pending;
        } finally {
            lock.unlock();
        }
    }

    public int pending() {
        lock.lock();
        try {
            return queue.size();
        } finally {
            lock.unlock();
        }
    }

    public long dropped() {
        lock.lock();
        try {
            return dropped;
        } finally {
            lock.unlock();
        }
    }

    public long delivered() {
        lock.lock();
        try {
            return delivered;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stops accepting new alerts. Returns {@code false} when draining or closing already started.
     */
    boolean beginDraining() {
        lock.lock();
        try {
            if (state != SubscriberState.ACTIVE) {
                return false;
            }
            state = SubscriberState.DRAINING;
            notEmpty.signalAll();
            return true;
        } finally {
            lock.unlock();
        }
    }

    void close() {
        lock.lock();
        try {
            queue.clear();
            state = SubscriberState.CLOSED;
            notEmpty.signalAll();
        } finally {
            lock.unlock();
        }
    }
}

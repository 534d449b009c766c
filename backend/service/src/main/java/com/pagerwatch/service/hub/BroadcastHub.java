package com.pagerwatch.service.hub;

import com.pagerwatch.core.bus.EventBus;
import com.pagerwatch.core.events.SubscriberDropped;
import com.pagerwatch.core.model.Alert;
import com.pagerwatch.core.model.AlertFilter;
import com.pagerwatch.service.store.AlertStore;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fan-out of live alerts to filtered subscribers.
 * <p>
 * {@link #publish} walks a copy of the registry taken when it starts, evaluates each filter and
 * enqueues without blocking; a full queue loses its oldest entry. The live channel is therefore
 * lossy under overload while the store keeps the complete history.
 */
public class BroadcastHub {
    private static final Logger LOGGER = Logger.getLogger(BroadcastHub.class.getName());
    private static final long DROP_LOG_EVERY = 100;

    private final AlertStore store;
    private final int queueCapacity;
    private final EventBus eventBus;
    private final Clock clock;
    private final Map<Long, Subscriber> subscribers = new ConcurrentHashMap<>();
    private final AtomicLong nextSubscriberId = new AtomicLong();
    private final LongAdder droppedTotal = new LongAdder();
    private final LongAdder deliveredTotal = new LongAdder();

    public BroadcastHub(AlertStore store, int queueCapacity, EventBus eventBus, Clock clock) {
        if (queueCapacity < 1) {
            throw new IllegalArgumentException("queueCapacity must be positive");
        }
        this.store = store;
        this.queueCapacity = queueCapacity;
        this.eventBus = eventBus;
        this.clock = clock;
    }

    /**
     * Registers a subscriber and returns it together with the matching history. Registration
     * happens before the history is read, so no alert appended in between is missed. If reading
     * the history fails the subscriber is removed again before the exception propagates.
     */
    public Subscription subscribe(AlertFilter filter, Optional<Duration> maxAge, int snapshotLimit) {
        Subscriber subscriber = new Subscriber(nextSubscriberId.incrementAndGet(), filter, queueCapacity);
        subscribers.put(subscriber.id(), subscriber);

        List<Alert> snapshot;
        try {
            snapshot = store.query(filter, maxAge, snapshotLimit);
        } catch (RuntimeException e) {
            unsubscribe(subscriber);
            throw e;
        }
        if (!snapshot.isEmpty()) {
            subscriber.skipThrough(snapshot.get(0).id());
        }
        LOGGER.fine(() -> "Subscriber " + subscriber.id() + " connected with " + snapshot.size() + " snapshot alerts");
        return new Subscription(subscriber, snapshot);
    }

    /**
     * @return number of subscribers the alert was queued for
     */
    public int publish(Alert alert) {
        int matched = 0;
        for (Subscriber subscriber : List.copyOf(subscribers.values())) {
            if (!matches(subscriber, alert)) {
                continue;
            }
            matched++;
            deliveredTotal.increment();
            Optional<Alert> discarded = subscriber.offer(alert);
            if (discarded.isPresent()) {
                onDropped(subscriber, discarded.get());
            }
        }
        return matched;
    }

    /**
     * Idempotent; safe to call from connection teardown paths.
     *
     * @return {@code true} if this call removed the subscriber
     */
    public boolean unsubscribe(Subscriber subscriber) {
        if (!subscriber.beginDraining()) {
            return false;
        }
        subscribers.remove(subscriber.id(), subscriber);
        long dropped = subscriber.dropped();
        subscriber.close();
        if (dropped > 0) {
            LOGGER.info("Subscriber " + subscriber.id() + " disconnected after dropping " + dropped + " live alerts");
        } else {
            LOGGER.fine(() -> "Subscriber " + subscriber.id() + " disconnected");
        }
        return true;
    }

    public int subscriberCount() {
        return subscribers.size();
    }

    public long droppedTotal() {
        return droppedTotal.sum();
    }

    public long deliveredTotal() {
        return deliveredTotal.sum();
    }

    private boolean matches(Subscriber subscriber, Alert alert) {
        try {
            return subscriber.filter().test(alert);
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Filter of subscriber " + subscriber.id() + " failed on alert " + alert.id(), e);
            return false;
        }
    }

    private void onDropped(Subscriber subscriber, Alert discarded) {
        droppedTotal.increment();
        long dropped = subscriber.dropped();
        if (dropped == 1 || dropped % DROP_LOG_EVERY == 0) {
            LOGGER.warning("Subscriber " + subscriber.id() + " is not keeping up; " + dropped + " live alerts dropped so far");
        }
        eventBus.publish(new SubscriberDropped(clock.instant(), subscriber.id(), discarded.id(), dropped));
    }
}

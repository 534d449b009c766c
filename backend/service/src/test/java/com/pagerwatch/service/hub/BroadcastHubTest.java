package com.pagerwatch.service.hub;

import com.pagerwatch.core.bus.EventBus;
import com.pagerwatch.core.events.SubscriberDropped;
import com.pagerwatch.core.model.Alert;
import com.pagerwatch.core.model.AlertFilter;
import com.pagerwatch.core.model.Priority;
import com.pagerwatch.core.model.Service;
import com.pagerwatch.service.store.RetentionStore;
import com.pagerwatch.service.support.FailingQueryStore;
import com.pagerwatch.service.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.pagerwatch.service.support.TestAlerts.alert;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BroadcastHubTest {
    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private final MutableClock clock = new MutableClock(NOW);
    private final EventBus eventBus = new EventBus();
    private final RetentionStore store = new RetentionStore(clock, Duration.ofDays(3));

    @Test
    void publishDeliversOnlyToMatchingSubscribers() {
        BroadcastHub hub = new BroadcastHub(store, 16, eventBus, clock);
        Subscriber fire = hub.subscribe(filterService(Service.FIRE), Optional.empty(), 10).subscriber();
        Subscriber everything = hub.subscribe(AlertFilter.all(), Optional.empty(), 10).subscriber();

        Alert ambulance = store.append(alert(NOW, "A1 Rit", Service.AMBULANCE, Priority.A1, "0120901"));
        Alert brand = store.append(alert(NOW, "P 1 Brand", Service.FIRE, Priority.P1, "1420001"));

        assertEquals(1, hub.publish(ambulance));
        assertEquals(2, hub.publish(brand));

        assertEquals(List.of(brand.id()), ids(fire.drain()));
        assertEquals(List.of(ambulance.id(), brand.id()), ids(everything.drain()));
    }

    @Test
    void slowSubscriberKeepsMostRecentAlertsWithoutAffectingOthers() {
        List<SubscriberDropped> drops = new CopyOnWriteArrayList<>();
        eventBus.subscribe(SubscriberDropped.class, drops::add);
        BroadcastHub hub = new BroadcastHub(store, 4, eventBus, clock);
        Subscriber slow = hub.subscribe(AlertFilter.all(), Optional.empty(), 10).subscriber();
        Subscriber fast = hub.subscribe(AlertFilter.all(), Optional.empty(), 10).subscriber();

        List<Long> fastSeen = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            hub.publish(store.append(alert(NOW, "msg " + i)));
            fastSeen.addAll(ids(fast.drain()));
        }

        assertEquals(List.of(7L, 8L, 9L, 10L), ids(slow.drain()));
        assertEquals(6, slow.dropped());
        assertEquals(10, fastSeen.size());
        assertEquals(0, fast.dropped());
        assertEquals(6, hub.droppedTotal());
        assertEquals(6, drops.size());
        assertEquals(1L, drops.get(0).droppedAlertId());
    }

    @Test
    void unsubscribeIsIdempotentAndStopsDelivery() {
        BroadcastHub hub = new BroadcastHub(store, 8, eventBus, clock);
        Subscriber subscriber = hub.subscribe(AlertFilter.all(), Optional.empty(), 10).subscriber();

        assertTrue(hub.unsubscribe(subscriber));
        assertFalse(hub.unsubscribe(subscriber));
        assertEquals(SubscriberState.CLOSED, subscriber.state());
        assertEquals(0, hub.subscriberCount());

        assertEquals(0, hub.publish(store.append(alert(NOW, "after close"))));
        assertEquals(0, subscriber.pending());
    }

    @Test
    void repeatedSubscribeUnsubscribeCyclesLeaveRegistryEmpty() {
        BroadcastHub hub = new BroadcastHub(store, 8, eventBus, clock);

        for (int i = 0; i < 1_000; i++) {
            Subscriber subscriber = hub.subscribe(AlertFilter.all(), Optional.empty(), 5).subscriber();
            if (i % 7 == 0) {
                hub.publish(store.append(alert(NOW, "tick " + i)));
            }
            hub.unsubscribe(subscriber);
        }

        assertEquals(0, hub.subscriberCount());
    }

    @Test
    void concurrentChurnWhilePublishingLeavesRegistryEmpty() throws Exception {
        BroadcastHub hub = new BroadcastHub(store, 8, eventBus, clock);
        ExecutorService executor = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);
        try {
            Future<?> publisher = executor.submit(() -> {
                start.await();
                for (int i = 0; i < 2_000; i++) {
                    hub.publish(store.append(alert(NOW, "live " + i)));
                }
                return null;
            });
            List<Future<?>> churners = new ArrayList<>();
            for (int t = 0; t < 3; t++) {
                churners.add(executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < 1_000; i++) {
                        Subscriber subscriber = hub.subscribe(AlertFilter.all(), Optional.empty(), 1).subscriber();
                        hub.unsubscribe(subscriber);
                    }
                    return null;
                }));
            }
            start.countDown();
            publisher.get(30, TimeUnit.SECONDS);
            for (Future<?> churner : churners) {
                churner.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(0, hub.subscriberCount());
    }

    @Test
    void subscribeReturnsFilteredSnapshotNewestFirst() {
        BroadcastHub hub = new BroadcastHub(store, 8, eventBus, clock);
        store.append(alert(NOW.minusSeconds(3), "Brand Beemster"));
        store.append(alert(NOW.minusSeconds(2), "Ambulance Purmerend"));
        store.append(alert(NOW.minusSeconds(1), "Wateroverlast Beemster"));

        Subscription subscription = hub.subscribe(AlertFilter.bodyContains("beemster"), Optional.empty(), 10);

        assertEquals(List.of(3L, 1L), ids(subscription.snapshot()));
    }

    @Test
    void alertsAlreadyInSnapshotAreNotDeliveredAgainLive() {
        BroadcastHub hub = new BroadcastHub(store, 8, eventBus, clock);
        Alert beforeSubscribe = store.append(alert(NOW, "in snapshot"));

        Subscription subscription = hub.subscribe(AlertFilter.all(), Optional.empty(), 10);
        // a publish racing with subscribe can arrive after registration
        hub.publish(beforeSubscribe);
        Alert after = store.append(alert(NOW, "live only"));
        hub.publish(after);

        assertEquals(List.of(beforeSubscribe.id()), ids(subscription.snapshot()));
        assertEquals(List.of(after.id()), ids(subscription.subscriber().drain()));
    }

    @Test
    void failedSnapshotQueryLeavesNoSubscriberBehind() {
        FailingQueryStore failing = new FailingQueryStore(store);
        BroadcastHub hub = new BroadcastHub(failing, 8, eventBus, clock);

        for (int i = 0; i < 1_000; i++) {
            assertThrows(IllegalStateException.class,
                    () -> hub.subscribe(AlertFilter.all(), Optional.empty(), 10));
        }

        assertEquals(1_000, failing.failedQueries());
        assertEquals(0, hub.subscriberCount());
        assertEquals(0, hub.publish(failing.append(alert(NOW, "nobody listening"))));
    }

    @Test
    void hugeMaxAgeReturnsWholeHistoryInsteadOfFailing() {
        BroadcastHub hub = new BroadcastHub(store, 8, eventBus, clock);
        store.append(alert(NOW.minus(Duration.ofDays(2)), "eergisteren"));

        Subscription subscription = hub.subscribe(AlertFilter.all(),
                Optional.of(Duration.ofMinutes(1_000_000_000_000_000L)), 10);

        assertEquals(1, subscription.snapshot().size());
        assertEquals(1, hub.subscriberCount());
        hub.unsubscribe(subscription.subscriber());
    }

    private static AlertFilter filterService(Service service) {
        return new AlertFilter(Optional.empty(), Optional.of(service), Optional.empty(), Optional.empty());
    }

    private static List<Long> ids(List<Alert> alerts) {
        return alerts.stream().map(Alert::id).toList();
    }
}

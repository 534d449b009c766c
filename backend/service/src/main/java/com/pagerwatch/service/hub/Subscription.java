package com.pagerwatch.service.hub;

import com.pagerwatch.core.model.Alert;

import java.util.List;

/**
 * Result of {@link BroadcastHub#subscribe}: the live handle plus the matching history, newest first.
 * Live alerts already contained in {@code snapshot} are not delivered again through the queue.
 */
public record Subscription(Subscriber subscriber, List<Alert> snapshot) {
    public Subscription {
        snapshot = List.copyOf(snapshot);
    }
}

package com.pagerwatch.core.events;

import java.time.Instant;

/**
 * Emitted when a live subscriber's queue was full and its oldest pending alert was discarded.
 */
public record SubscriberDropped(Instant timestamp, long subscriberId, long droppedAlertId, long droppedTotal) implements PipelineEvent {
    @Override
    public String type() {
        return "SubscriberDropped";
    }
}

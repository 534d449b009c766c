package com.pagerwatch.core.events;

import java.time.Instant;

public record SnapshotFailed(Instant timestamp, String message) implements PipelineEvent {
    @Override
    public String type() {
        return "SnapshotFailed";
    }
}

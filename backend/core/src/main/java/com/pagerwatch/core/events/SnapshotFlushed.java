package com.pagerwatch.core.events;

import java.time.Instant;

public record SnapshotFlushed(Instant timestamp, int alertCount, long highWaterMark, long durationMillis) implements PipelineEvent {
    @Override
    public String type() {
        return "SnapshotFlushed";
    }
}

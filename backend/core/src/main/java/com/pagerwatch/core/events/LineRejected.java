package com.pagerwatch.core.events;

import java.time.Instant;

public record LineRejected(Instant timestamp, String reason, String line) implements PipelineEvent {
    @Override
    public String type() {
        return "LineRejected";
    }
}

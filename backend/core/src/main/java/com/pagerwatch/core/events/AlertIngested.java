package com.pagerwatch.core.events;

import com.pagerwatch.core.model.Priority;
import com.pagerwatch.core.model.Service;

import java.time.Instant;

public record AlertIngested(
        Instant timestamp,
        long alertId,
        Service service,
        Priority priority,
        int deliveredTo
) implements PipelineEvent {
    @Override
    public String type() {
        return "AlertIngested";
    }
}

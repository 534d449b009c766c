package com.pagerwatch.core.events;

import java.time.Instant;

public interface PipelineEvent {
    Instant timestamp();

    String type();
}

package com.pagerwatch.core.events;

import java.time.Instant;

public record CapcodesReloaded(Instant timestamp, String source, int recordCount, int skippedRows) implements PipelineEvent {
    @Override
    public String type() {
        return "CapcodesReloaded";
    }
}

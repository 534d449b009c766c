package com.pagerwatch.service.store;

import com.pagerwatch.core.model.Alert;

import java.util.List;

/**
 * On-disk layout of the alert history. Readers ignore fields they do not know.
 */
public record SnapshotDocument(int version, long highWaterMark, List<Alert> alerts) {
    public static final int CURRENT_VERSION = 1;

    public SnapshotDocument {
        alerts = alerts == null ? List.of() : List.copyOf(alerts);
    }
}

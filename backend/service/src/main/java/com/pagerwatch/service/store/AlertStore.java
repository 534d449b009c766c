package com.pagerwatch.service.store;

import com.pagerwatch.core.model.Alert;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

public interface AlertStore {
    /**
     * Assigns the next sequence id and appends. Never performs disk I/O.
     */
    Alert append(Alert alert);

    /**
     * Matching alerts, newest first.
     */
    List<Alert> query(Predicate<Alert> filter, Optional<Duration> maxAge, int limit);

    int evict(Instant now);

    long highWaterMark();

    int size();
}

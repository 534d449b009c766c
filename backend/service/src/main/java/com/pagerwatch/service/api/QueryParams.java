package com.pagerwatch.service.api;

import com.pagerwatch.core.model.AlertFilter;
import com.pagerwatch.core.model.Priority;
import com.pagerwatch.core.model.Service;

import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Request parameters shared by the history and stream endpoints. Invalid values raise
 * {@link IllegalArgumentException}; callers answer 400.
 */
final class QueryParams {
    static final long MAX_AGE_MINUTES_LIMIT = 525_600;

    private final Map<String, String> values;

    private QueryParams(Map<String, String> values) {
        this.values = values;
    }

    static QueryParams of(URI uri) {
        Map<String, String> query = new HashMap<>();
        String raw = uri.getRawQuery();
        if (raw == null || raw.isBlank()) {
            return new QueryParams(query);
        }
        for (String entry : raw.split("&")) {
            if (entry.isEmpty()) {
                continue;
            }
            String[] pair = entry.split("=", 2);
            String key = URLDecoder.decode(pair[0], StandardCharsets.UTF_8);
            String value = pair.length > 1 ? URLDecoder.decode(pair[1], StandardCharsets.UTF_8) : "";
            query.put(key, value);
        }
        return new QueryParams(query);
    }

    Optional<String> get(String name) {
        return Optional.ofNullable(values.get(name)).map(String::trim).filter(value -> !value.isEmpty());
    }

    AlertFilter filter() {
        Optional<Service> service = get("service").map(QueryParams::service);
        Optional<Priority> priority = get("priority").map(value -> Priority.fromToken(value)
                .orElseThrow(() -> new IllegalArgumentException("Unknown priority " + value)));
        return new AlertFilter(get("q"), service, priority, get("capcode"));
    }

    private static Service service(String value) {
        Service resolved = Service.fromTag(value);
        if (resolved == Service.UNKNOWN && !"unknown".equals(value.toLowerCase(Locale.ROOT))) {
            throw new IllegalArgumentException("Unknown service " + value);
        }
        return resolved;
    }

    Optional<Duration> maxAge() {
        Optional<Long> minutes = get("maxAgeMinutes").map(Long::parseLong);
        if (minutes.isPresent() && minutes.get() < 0) {
            throw new IllegalArgumentException("maxAgeMinutes must not be negative");
        }
        if (minutes.isPresent() && minutes.get() > MAX_AGE_MINUTES_LIMIT) {
            throw new IllegalArgumentException("maxAgeMinutes must not exceed " + MAX_AGE_MINUTES_LIMIT);
        }
        return minutes.map(Duration::ofMinutes);
    }

    int limit(int fallback, int ceiling) {
        int limit = get("limit").map(Integer::parseInt).orElse(fallback);
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be positive");
        }
        return Math.min(limit, ceiling);
    }
}

package com.pagerwatch.core.model;

import java.util.Locale;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Viewer filter over alert fields. Every present criterion must match; an empty filter
 * accepts everything. Instances are immutable and safe to evaluate from any thread.
 */
public record AlertFilter(
        Optional<String> text,
        Optional<Service> service,
        Optional<Priority> priority,
        Optional<String> capcode
) implements Predicate<Alert> {
    private static final AlertFilter ALL = new AlertFilter(Optional.empty(), Optional.empty(), Optional.empty(), Optional.empty());

    public AlertFilter {
        text = normalize(text).map(value -> value.toLowerCase(Locale.ROOT));
        service = service == null ? Optional.empty() : service;
        priority = priority == null ? Optional.empty() : priority;
        capcode = normalize(capcode);
    }

    public static AlertFilter all() {
        return ALL;
    }

    public static AlertFilter bodyContains(String substring) {
        return new AlertFilter(Optional.ofNullable(substring), Optional.empty(), Optional.empty(), Optional.empty());
    }

    public boolean isEmpty() {
        return text.isEmpty() && service.isEmpty() && priority.isEmpty() && capcode.isEmpty();
    }

    @Override
    public boolean test(Alert alert) {
        if (text.isPresent() && !alert.body().toLowerCase(Locale.ROOT).contains(text.get())) {
            return false;
        }
        if (service.isPresent() && alert.service() != service.get()) {
            return false;
        }
        if (priority.isPresent() && alert.priority() != priority.get()) {
            return false;
        }
        if (capcode.isEmpty()) {
            return true;
        }
        for (String candidate : alert.capcodes()) {
            if (candidate.equals(capcode.get()) || Capcodes.sameCapcode(candidate, capcode.get())) {
                return true;
            }
        }
        return false;
    }

    private static Optional<String> normalize(Optional<String> value) {
        if (value == null) {
            return Optional.empty();
        }
        return value.map(String::trim).filter(v -> !v.isEmpty());
    }
}

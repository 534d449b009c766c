package com.pagerwatch.core.model;

import java.util.Locale;
import java.util.Optional;

public enum Priority {
    A0,
    A1,
    A2,
    B1,
    B2,
    P1,
    TEST,
    UNKNOWN;

    /**
     * Maps a dispatch token to a priority. Whitespace inside the token is ignored so that
     * {@code "P 1"} resolves to {@link #P1}; {@code UNKNOWN} is never returned from here.
     */
    public static Optional<Priority> fromToken(String token) {
        if (token == null) {
            return Optional.empty();
        }
        String normalized = token.replaceAll("\\s+", "").toUpperCase(Locale.ROOT);
        for (Priority priority : values()) {
            if (priority != UNKNOWN && priority.name().equals(normalized)) {
                return Optional.of(priority);
            }
        }
        return Optional.empty();
    }
}

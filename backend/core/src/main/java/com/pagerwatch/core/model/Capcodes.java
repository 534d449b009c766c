package com.pagerwatch.core.model;

import java.util.Optional;

public final class Capcodes {
    public static final int CANONICAL_LENGTH = 7;

    private Capcodes() {
    }

    /**
     * Canonical 7-digit form of a capcode. FLEX decoders print 9-digit addresses with a
     * frame prefix, capcode lists often drop leading zeros; both map to the same key.
     */
    public static Optional<String> normalize(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String trimmed = raw.trim();
        if (trimmed.isEmpty() || !trimmed.chars().allMatch(Character::isDigit)) {
            return Optional.empty();
        }
        if (trimmed.length() > CANONICAL_LENGTH) {
            return Optional.of(trimmed.substring(trimmed.length() - CANONICAL_LENGTH));
        }
        return Optional.of("0".repeat(CANONICAL_LENGTH - trimmed.length()) + trimmed);
    }

    public static boolean sameCapcode(String left, String right) {
        Optional<String> normalizedLeft = normalize(left);
        return normalizedLeft.isPresent() && normalizedLeft.equals(normalize(right));
    }
}

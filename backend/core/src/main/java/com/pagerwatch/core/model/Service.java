package com.pagerwatch.core.model;

import java.util.Locale;

public enum Service {
    FIRE("service-fire"),
    AMBULANCE("service-ambulance"),
    POLICE("service-police"),
    TRAUMA_HELI("service-trauma"),
    UNKNOWN("service-unknown");

    private final String colorClass;

    Service(String colorClass) {
        this.colorClass = colorClass;
    }

    public String colorClass() {
        return colorClass;
    }

    /**
     * Resolves a free-form service tag such as {@code Fire}, {@code TraumaHeli} or the Dutch
     * {@code Brandweer}. Trauma/helicopter keywords take precedence because trauma units are
     * usually listed under an ambulance region.
     */
    public static Service fromTag(String tag) {
        if (tag == null || tag.isBlank()) {
            return UNKNOWN;
        }
        String normalized = tag.trim().toLowerCase(Locale.ROOT).replace("_", "").replace(" ", "");
        for (Service service : values()) {
            if (service.name().replace("_", "").toLowerCase(Locale.ROOT).equals(normalized)) {
                return service;
            }
        }
        if (containsAny(normalized, "trauma", "heli", "lifeliner", "mmt")) {
            return TRAUMA_HELI;
        }
        if (containsAny(normalized, "brandweer", "fire")) {
            return FIRE;
        }
        if (containsAny(normalized, "ambulance", "rav", "ghor")) {
            return AMBULANCE;
        }
        if (containsAny(normalized, "politie", "kmar", "police")) {
            return POLICE;
        }
        return UNKNOWN;
    }

    private static boolean containsAny(String value, String... needles) {
        for (String needle : needles) {
            if (value.contains(needle)) {
                return true;
            }
        }
        return false;
    }
}

package com.pagerwatch.core.model;

import java.util.Objects;
import java.util.Optional;

public record CapcodeRecord(
        String capcode,
        String alias,
        Service service,
        Optional<Priority> priorityHint
) {
    public CapcodeRecord {
        Objects.requireNonNull(capcode, "capcode is required");
        alias = alias == null ? "" : alias;
        service = service == null ? Service.UNKNOWN : service;
        priorityHint = priorityHint == null ? Optional.empty() : priorityHint;
    }

    public static CapcodeRecord unknown(String capcode) {
        return new CapcodeRecord(capcode, "", Service.UNKNOWN, Optional.empty());
    }

    public boolean isUnknown() {
        return service == Service.UNKNOWN && alias.isEmpty();
    }
}

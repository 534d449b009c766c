package com.pagerwatch.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * One decoded pager message. {@code capcodes} keeps decoder order and is never empty;
 * {@code timestamp} is the decoder's own time when it could be read, otherwise the receive time.
 */
public record ParsedMessage(
        List<String> capcodes,
        String body,
        Protocol protocol,
        Instant timestamp,
        Instant receivedAt,
        String localTime,
        String messageType
) {
    public ParsedMessage {
        Objects.requireNonNull(capcodes, "capcodes is required");
        if (capcodes.isEmpty()) {
            throw new IllegalArgumentException("capcodes must not be empty");
        }
        capcodes = List.copyOf(capcodes);
        body = body == null ? "" : body;
        protocol = protocol == null ? Protocol.UNKNOWN : protocol;
        Objects.requireNonNull(timestamp, "timestamp is required");
        receivedAt = receivedAt == null ? timestamp : receivedAt;
        localTime = localTime == null ? "" : localTime;
        messageType = messageType == null ? "" : messageType;
    }
}

package com.pagerwatch.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * A classified pager message. Alerts are created by the classifier with {@link #UNASSIGNED_ID}
 * and receive their sequence number from the store on append.
 */
public record Alert(
        long id,
        Instant timestamp,
        Instant receivedAt,
        Protocol protocol,
        String messageType,
        String localTime,
        List<String> capcodes,
        String body,
        Service service,
        Priority priority,
        String colorClass,
        List<String> matchedAliases,
        List<Recipient> recipients
) {
    public static final long UNASSIGNED_ID = 0L;

    public Alert {
        Objects.requireNonNull(timestamp, "timestamp is required");
        receivedAt = receivedAt == null ? timestamp : receivedAt;
        protocol = protocol == null ? Protocol.UNKNOWN : protocol;
        messageType = messageType == null ? "" : messageType;
        localTime = localTime == null ? "" : localTime;
        capcodes = capcodes == null ? List.of() : List.copyOf(capcodes);
        body = body == null ? "" : body;
        service = service == null ? Service.UNKNOWN : service;
        priority = priority == null ? Priority.UNKNOWN : priority;
        colorClass = colorClass == null ? service.colorClass() : colorClass;
        matchedAliases = matchedAliases == null ? List.of() : List.copyOf(matchedAliases);
        recipients = recipients == null ? List.of() : List.copyOf(recipients);
    }

    public Alert withId(long assignedId) {
        return new Alert(
                assignedId,
                timestamp,
                receivedAt,
                protocol,
                messageType,
                localTime,
                capcodes,
                body,
                service,
                priority,
                colorClass,
                matchedAliases,
                recipients
        );
    }
}

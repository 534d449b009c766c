package com.pagerwatch.pipeline.classify;

import com.pagerwatch.core.model.Alert;
import com.pagerwatch.core.model.CapcodeRecord;
import com.pagerwatch.core.model.ParsedMessage;
import com.pagerwatch.core.model.Priority;
import com.pagerwatch.core.model.Recipient;
import com.pagerwatch.core.model.Service;
import com.pagerwatch.pipeline.capcode.CapcodeTable;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Enriches a parsed message with capcode metadata and a dispatch priority.
 * <p>
 * Service and colour come from the first capcode that exists in the table. Priority is the
 * leftmost token in the body. When the body has none, this classifier goes beyond plain token
 * matching and falls back to the priority hint of that same first matching capcode; only without
 * a hint does the result become {@link Priority#UNKNOWN}. Unmatched messages classify as
 * {@link Service#UNKNOWN} and are still returned.
 */
public final class Classifier {
    private Classifier() {
    }

    public static Alert classify(ParsedMessage message, CapcodeTable table) {
        Optional<CapcodeRecord> primary = Optional.empty();
        Set<String> aliases = new LinkedHashSet<>();
        List<Recipient> recipients = new ArrayList<>();

        for (String capcode : message.capcodes()) {
            Optional<CapcodeRecord> record = table.find(capcode);
            if (record.isPresent()) {
                CapcodeRecord found = record.get();
                if (primary.isEmpty()) {
                    primary = record;
                }
                if (!found.alias().isEmpty()) {
                    aliases.add(found.alias());
                }
                recipients.add(new Recipient(capcode, found.alias(), found.service()));
            } else {
                recipients.add(new Recipient(capcode, "", Service.UNKNOWN));
            }
        }

        Optional<CapcodeRecord> first = primary;
        Service service = first.map(CapcodeRecord::service).orElse(Service.UNKNOWN);
        Priority priority = PriorityExtractor.extract(message.body())
                .or(() -> first.flatMap(CapcodeRecord::priorityHint))
                .orElse(Priority.UNKNOWN);

        return new Alert(
                Alert.UNASSIGNED_ID,
                message.timestamp(),
                message.receivedAt(),
                message.protocol(),
                message.messageType(),
                message.localTime(),
                message.capcodes(),
                message.body(),
                service,
                priority,
                service.colorClass(),
                new ArrayList<>(aliases),
                recipients
        );
    }
}

package com.pagerwatch.pipeline.parse;

import com.pagerwatch.core.model.Capcodes;
import com.pagerwatch.core.model.ParsedMessage;
import com.pagerwatch.core.model.Protocol;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * multimon-ng raw FLEX output:
 * <pre>FLEX|2026-03-01 11:02:03|1600/2/K/A|08.120|001234567 001234568|ALN|A1 Brandweer ...</pre>
 * The time, capcode list, message type and body are read from fixed positions counted from both
 * ends, so decoders that add or omit frame fields in the middle still parse. All capcodes of a
 * group call end up in one message.
 */
public final class FlexLineGrammar implements LineGrammar {
    static final String PREFIX = "FLEX|";
    private static final int MAX_FIELDS = 7;
    private static final int MIN_FIELDS = 5;
    private static final DateTimeFormatter DECODER_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final ZoneId decoderZone;

    public FlexLineGrammar(ZoneId decoderZone) {
        this.decoderZone = decoderZone;
    }

    @Override
    public String name() {
        return "flex";
    }

    @Override
    public boolean accepts(String line) {
        return line.startsWith(PREFIX);
    }

    @Override
    public ParseResult parse(String line, Instant receivedAt) {
        String[] fields = line.split("\\|", MAX_FIELDS);
        if (fields.length < MIN_FIELDS) {
            return ParseResult.failure("FLEX line has " + fields.length + " fields, expected at least " + MIN_FIELDS);
        }
        String localTime = fields[1].trim();
        String capcodeField = fields[fields.length - 3].trim();
        String messageType = fields[fields.length - 2].trim();
        String body = fields[fields.length - 1].trim();

        if (capcodeField.isEmpty()) {
            return ParseResult.failure("FLEX line has no capcodes");
        }
        Set<String> capcodes = new LinkedHashSet<>();
        for (String token : capcodeField.split("\\s+")) {
            if (Capcodes.normalize(token).isEmpty()) {
                return ParseResult.failure("FLEX line has invalid capcode '" + token + "'");
            }
            capcodes.add(token);
        }
        if (messageType.isEmpty()) {
            return ParseResult.failure("FLEX line has no message type");
        }

        ParsedMessage message = new ParsedMessage(
                new ArrayList<>(capcodes),
                body,
                Protocol.FLEX,
                decoderTime(localTime, receivedAt),
                receivedAt,
                localTime,
                messageType
        );
        return ParseResult.success(List.of(message));
    }

    private Instant decoderTime(String localTime, Instant receivedAt) {
        try {
            return LocalDateTime.parse(localTime, DECODER_TIME).atZone(decoderZone).toInstant();
        } catch (DateTimeParseException e) {
            return receivedAt;
        }
    }
}

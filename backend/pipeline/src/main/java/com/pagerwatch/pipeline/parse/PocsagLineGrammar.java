package com.pagerwatch.pipeline.parse;

import com.pagerwatch.core.model.ParsedMessage;
import com.pagerwatch.core.model.Protocol;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * multimon-ng POCSAG output:
 * <pre>POCSAG1200: Address: 1234567  Function: 0  Alpha:   A2 Ambulance ...</pre>
 * POCSAG frames carry no timestamp, so the receive time is used. Tone-only pages have no body.
 */
public final class PocsagLineGrammar implements LineGrammar {
    static final String PREFIX = "POCSAG";
    private static final Pattern LINE = Pattern.compile(
            "^POCSAG(\\d+):\\s+Address:\\s*(\\d+)\\s+Function:\\s*(\\d)(?:\\s+(Alpha|Numeric):\\s?(.*))?$"
    );
    private static final Pattern CONTROL_MARKERS = Pattern.compile("<(NUL|EOT|ETX|ETB|CR|LF)>");
    private static final DateTimeFormatter LOCAL_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final ZoneId decoderZone;

    public PocsagLineGrammar(ZoneId decoderZone) {
        this.decoderZone = decoderZone;
    }

    @Override
    public String name() {
        return "pocsag";
    }

    @Override
    public boolean accepts(String line) {
        return line.startsWith(PREFIX);
    }

    @Override
    public ParseResult parse(String line, Instant receivedAt) {
        Matcher matcher = LINE.matcher(line);
        if (!matcher.matches()) {
            return ParseResult.failure("POCSAG line does not match 'Address/Function' layout");
        }
        String messageType = matcher.group(4) == null ? "Tone" : matcher.group(4);
        String body = matcher.group(5) == null ? "" : CONTROL_MARKERS.matcher(matcher.group(5)).replaceAll("").trim();

        ParsedMessage message = new ParsedMessage(
                List.of(matcher.group(2)),
                body,
                Protocol.POCSAG,
                receivedAt,
                receivedAt,
                LOCAL_TIME.format(receivedAt.atZone(decoderZone)),
                messageType
        );
        return ParseResult.success(List.of(message));
    }
}

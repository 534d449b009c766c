package com.pagerwatch.pipeline.parse;

import java.time.Instant;
import java.time.ZoneId;
import java.util.List;

/**
 * Turns one complete decoder line into messages. Never throws for bad input: anything that is not
 * a recognised decoder record comes back as a failed {@link ParseResult} with a reason.
 */
public class LineParser {
    private final List<LineGrammar> grammars;

    public LineParser(ZoneId decoderZone) {
        this(List.of(new FlexLineGrammar(decoderZone), new PocsagLineGrammar(decoderZone)));
    }

    public LineParser(List<LineGrammar> grammars) {
        this.grammars = List.copyOf(grammars);
    }

    public ParseResult parse(String line, Instant receivedAt) {
        if (line == null) {
            return ParseResult.failure("null line");
        }
        String trimmed = line.strip();
        if (trimmed.isEmpty()) {
            return ParseResult.failure("blank line");
        }
        for (LineGrammar grammar : grammars) {
            if (!grammar.accepts(trimmed)) {
                continue;
            }
            try {
                return grammar.parse(trimmed, receivedAt);
            } catch (RuntimeException e) {
                return ParseResult.failure(grammar.name() + " grammar failed: " + e.getMessage());
            }
        }
        return ParseResult.failure("unrecognized decoder line");
    }
}

package com.pagerwatch.pipeline.parse;

import java.time.Instant;

/**
 * One decoder output dialect. {@link #accepts} must be a cheap prefix check; {@link #parse} is only
 * called for accepted lines and reports malformed content as a failed {@link ParseResult}.
 */
public interface LineGrammar {
    String name();

    boolean accepts(String line);

    ParseResult parse(String line, Instant receivedAt);
}

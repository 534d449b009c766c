package com.pagerwatch.pipeline.classify;

import com.pagerwatch.core.model.Priority;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class PriorityExtractor {
    private static final Pattern TOKEN = Pattern.compile("\\b(A0|A1|A2|B1|B2|P\\s*1|TEST)\\b", Pattern.CASE_INSENSITIVE);

    private PriorityExtractor() {
    }

    /**
     * Leftmost priority token in the text, if any.
     */
    public static Optional<Priority> extract(String text) {
        if (text == null || text.isEmpty()) {
            return Optional.empty();
        }
        Matcher matcher = TOKEN.matcher(text);
        if (!matcher.find()) {
            return Optional.empty();
        }
        return Priority.fromToken(matcher.group(1));
    }
}

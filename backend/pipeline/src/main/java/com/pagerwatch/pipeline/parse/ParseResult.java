package com.pagerwatch.pipeline.parse;

import com.pagerwatch.core.model.ParsedMessage;

import java.util.List;

public record ParseResult(boolean success, List<ParsedMessage> messages, String reason) {
    public ParseResult {
        messages = messages == null ? List.of() : List.copyOf(messages);
        reason = reason == null ? "" : reason;
    }

    public static ParseResult success(List<ParsedMessage> messages) {
        return new ParseResult(true, messages, "");
    }

    public static ParseResult failure(String reason) {
        return new ParseResult(false, List.of(), reason);
    }
}

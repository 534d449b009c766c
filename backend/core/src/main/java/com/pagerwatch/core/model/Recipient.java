package com.pagerwatch.core.model;

public record Recipient(String capcode, String alias, Service service) {
}

package com.pagerwatch.core.model;

public enum Protocol {
    FLEX,
    POCSAG,
    UNKNOWN
}

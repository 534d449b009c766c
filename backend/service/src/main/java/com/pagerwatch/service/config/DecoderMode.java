package com.pagerwatch.service.config;

public enum DecoderMode {
    STDIN,
    FILE,
    COMMAND
}

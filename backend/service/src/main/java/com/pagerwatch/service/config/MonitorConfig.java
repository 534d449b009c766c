package com.pagerwatch.service.config;

import java.time.Duration;
import java.time.ZoneId;

public record MonitorConfig(
        Integer httpPort,
        String capcodeFile,
        String historyFile,
        Duration retention,
        Duration flushInterval,
        Duration evictionInterval,
        Integer subscriberQueueCapacity,
        Integer snapshotLimit,
        Duration keepAliveInterval,
        ZoneId decoderZone,
        DecoderConfig decoder
) {
    public MonitorConfig {
        httpPort = httpPort == null ? 8112 : httpPort;
        capcodeFile = capcodeFile == null || capcodeFile.isBlank() ? "capcodelijst.csv" : capcodeFile;
        historyFile = historyFile == null || historyFile.isBlank() ? "p2000_history.json" : historyFile;
        retention = positiveOr(retention, Duration.ofDays(3));
        flushInterval = positiveOr(flushInterval, Duration.ofSeconds(5));
        evictionInterval = positiveOr(evictionInterval, Duration.ofMinutes(1));
        subscriberQueueCapacity = subscriberQueueCapacity == null || subscriberQueueCapacity < 1 ? 256 : subscriberQueueCapacity;
        snapshotLimit = snapshotLimit == null || snapshotLimit < 1 ? 500 : snapshotLimit;
        keepAliveInterval = positiveOr(keepAliveInterval, Duration.ofSeconds(15));
        decoderZone = decoderZone == null ? ZoneId.of("Europe/Amsterdam") : decoderZone;
        decoder = decoder == null ? DecoderConfig.stdin() : decoder;
    }

    public static MonitorConfig defaults() {
        return new MonitorConfig(null, null, null, null, null, null, null, null, null, null, null);
    }

    public MonitorConfig withHttpPort(int port) {
        return new MonitorConfig(
                port,
                capcodeFile,
                historyFile,
                retention,
                flushInterval,
                evictionInterval,
                subscriberQueueCapacity,
                snapshotLimit,
                keepAliveInterval,
                decoderZone,
                decoder
        );
    }

    private static Duration positiveOr(Duration value, Duration fallback) {
        return value == null || value.isZero() || value.isNegative() ? fallback : value;
    }
}

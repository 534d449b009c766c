package com.pagerwatch.service.hub;

public enum SubscriberState {
    ACTIVE,
    DRAINING,
    CLOSED
}

package com.conduit.model;

/**
 * Lifecycle events published on the gateway event bus.
 */
public enum GatewayEventType {
    REQUEST_STARTED,
    CACHE_HIT,
    CACHE_MISS,
    PROVIDER_CALL_SUCCEEDED,
    PROVIDER_CALL_FAILED,
    CIRCUIT_OPENED,
    CIRCUIT_CLOSED,
    BUDGET_EXCEEDED
}

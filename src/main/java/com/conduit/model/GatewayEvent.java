package com.conduit.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Transient lifecycle event. Never persisted by the gateway itself.
 */
@Value
@Builder
public class GatewayEvent {

    GatewayEventType type;

    String requestId;

    Instant timestamp;

    /**
     * Provider involved, if any.
     */
    String providerName;

    /**
     * Free-form detail (error message, latency, fingerprint).
     */
    String detail;

    public static GatewayEvent of(GatewayEventType type, String requestId, Instant timestamp) {
        return GatewayEvent.builder().type(type).requestId(requestId).timestamp(timestamp).build();
    }
}

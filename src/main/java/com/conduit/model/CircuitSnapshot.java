package com.conduit.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Read-only view of a provider's circuit breaker.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CircuitSnapshot {

    @JsonProperty("provider")
    String provider;

    @JsonProperty("state")
    CircuitState state;

    @JsonProperty("failure_count")
    int failureCount;

    @JsonProperty("opened_at")
    Instant openedAt;
}

package com.conduit.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Canonical completion response returned by the gateway.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CompletionResponse {

    @JsonProperty("request_id")
    String requestId;

    @JsonProperty("provider_name")
    String providerName;

    @JsonProperty("model")
    String model;

    @JsonProperty("content")
    String content;

    @JsonProperty("usage")
    TokenUsage usage;

    @JsonProperty("latency_ms")
    long latencyMs;

    @JsonProperty("cached")
    boolean cached;
}

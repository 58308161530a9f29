package com.conduit.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.Set;

/**
 * Capability and cost metadata of a registered provider.
 * Instances are snapshots: the registry owns the live in-flight counter and the
 * resilience layer owns the health state.
 */
@Value
@Builder(toBuilder = true)
public class ProviderDescriptor {

    @JsonProperty("name")
    String name;

    @JsonProperty("capabilities")
    Set<String> capabilities;

    @JsonProperty("cost_per_1k_input")
    BigDecimal costPer1kInput;

    @JsonProperty("cost_per_1k_output")
    BigDecimal costPer1kOutput;

    @JsonProperty("max_concurrency")
    int maxConcurrency;

    @JsonProperty("current_inflight")
    int currentInflight;

    @JsonProperty("health_state")
    CircuitState healthState;

    /**
     * Position in configuration order, used to break ties deterministically.
     */
    @JsonProperty("registration_order")
    int registrationOrder;

    public boolean supportsAll(Collection<String> tags) {
        return tags == null || capabilities.containsAll(tags);
    }
}

package com.conduit.model;

/**
 * Circuit breaker state of one provider.
 */
public enum CircuitState {

    /**
     * Calls pass through; failures are counted.
     */
    CLOSED,

    /**
     * Calls are rejected without reaching the provider until the cooldown elapses.
     */
    OPEN,

    /**
     * A single trial call is admitted to probe the provider.
     */
    HALF_OPEN
}

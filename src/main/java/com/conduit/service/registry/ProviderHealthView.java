package com.conduit.service.registry;

import com.conduit.model.CircuitState;

/**
 * Read-only health lookup the registry uses to filter out unavailable providers.
 */
@FunctionalInterface
public interface ProviderHealthView {

    ProviderHealthView ALWAYS_CLOSED = provider -> CircuitState.CLOSED;

    /**
     * Current circuit state of a provider. An open circuit whose cooldown has elapsed reports HALF_OPEN.
     */
    CircuitState stateOf(String provider);
}

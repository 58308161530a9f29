package com.conduit.service.resilience;

import com.conduit.exception.ProviderTransientException;
import com.conduit.model.CircuitSnapshot;
import com.conduit.model.CircuitState;
import com.conduit.service.registry.ProviderHealthView;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig.SlidingWindowType;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.stream.Collectors;

/**
 * One circuit per provider, created on first use from a shared Resilience4j configuration.
 *
 * The circuit opens once the last {@code failureThreshold} recorded calls have all failed,
 * and admits a single trial call after {@code cooldown}.
 */
@Slf4j
public class ProviderCircuitRegistry implements ProviderHealthView {

    private final ConcurrentMap<String, ProviderCircuit> circuits = new ConcurrentHashMap<>();
    private final CircuitBreakerConfig config;
    private final Duration cooldown;
    private final Clock clock;

    public ProviderCircuitRegistry(int failureThreshold, Duration cooldown, Clock clock) {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failure-threshold must be at least 1");
        }
        this.config = CircuitBreakerConfig.custom()
                .slidingWindowType(SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(failureThreshold)
                .minimumNumberOfCalls(failureThreshold)
                .failureRateThreshold(100)
                .waitDurationInOpenState(cooldown)
                .permittedNumberOfCallsInHalfOpenState(1)
                // call duration is bounded by the request deadline instead
                .slowCallDurationThreshold(Duration.ofDays(1))
                .ignoreException(error -> !(error instanceof ProviderTransientException))
                .build();
        this.cooldown = cooldown;
        this.clock = clock;
        log.info("Circuit breakers: failure-threshold={}, cooldown={}", failureThreshold, cooldown);
    }

    public ProviderCircuit forProvider(String provider) {
        return circuits.computeIfAbsent(provider, name -> new ProviderCircuit(name, config, cooldown, clock));
    }

    @Override
    public CircuitState stateOf(String provider) {
        ProviderCircuit circuit = circuits.get(provider);
        return circuit == null ? CircuitState.CLOSED : circuit.getState();
    }

    public List<CircuitSnapshot> snapshots() {
        return circuits.values().stream()
                .map(ProviderCircuit::snapshot)
                .sorted(Comparator.comparing(CircuitSnapshot::getProvider))
                .collect(Collectors.toList());
    }
}

package com.conduit.service.resilience;

import com.conduit.model.CircuitSnapshot;
import com.conduit.model.CircuitState;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.event.CircuitBreakerOnStateTransitionEvent;
import io.github.resilience4j.circuitbreaker.internal.CircuitBreakerStateMachine;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Circuit of one provider, backed by a Resilience4j {@link CircuitBreaker}.
 *
 * Every call goes through a {@link Permit} stamped with the circuit generation, which
 * moves on each state transition. A verdict carried by a permit from an earlier
 * generation is dropped, so a late result of a call admitted while CLOSED can never
 * decide a HALF_OPEN trial. Calls into the breaker run under this instance's monitor.
 */
@Slf4j
public class ProviderCircuit {

    private final String provider;
    private final CircuitBreaker breaker;
    private final Duration cooldown;
    private final Clock clock;

    private long generation;
    private Instant openedAt;

    ProviderCircuit(String provider, CircuitBreakerConfig config, Duration cooldown, Clock clock) {
        this.provider = provider;
        this.breaker = new CircuitBreakerStateMachine(provider, config, clock);
        this.cooldown = cooldown;
        this.clock = clock;
        breaker.getEventPublisher().onStateTransition(this::onStateTransition);
    }

    /**
     * Ask to send one call through.
     *
     * @return a permit, or empty if the circuit is open or a half-open trial is already running
     */
    public synchronized Optional<Permit> tryAcquirePermission() {
        if (!breaker.tryAcquirePermission()) {
            return Optional.empty();
        }
        if (breaker.getState() == CircuitBreaker.State.HALF_OPEN) {
            log.info("Circuit for {} is HALF_OPEN, admitting trial call", provider);
        }
        return Optional.of(new Permit(generation, clock.instant()));
    }

    /**
     * Record a successful call.
     *
     * @return true if this success closed a half-open circuit
     */
    public synchronized boolean onSuccess(Permit permit) {
        if (isStale(permit)) {
            return false;
        }
        long before = generation;
        breaker.onSuccess(elapsedNanos(permit), TimeUnit.NANOSECONDS);
        return generation != before && breaker.getState() == CircuitBreaker.State.CLOSED;
    }

    /**
     * Record a failed call. Only transient (and unknown) failures count; anything else
     * is ignored by the breaker and gives the permit back.
     *
     * @return true if this failure opened the circuit
     */
    public synchronized boolean onError(Permit permit, Throwable error) {
        if (isStale(permit)) {
            return false;
        }
        long before = generation;
        breaker.onError(elapsedNanos(permit), TimeUnit.NANOSECONDS, error);
        return generation != before && breaker.getState() == CircuitBreaker.State.OPEN;
    }

    /**
     * Give back a permit without a verdict (cancellation).
     */
    public synchronized void releasePermission(Permit permit) {
        if (isStale(permit)) {
            return;
        }
        breaker.releasePermission();
    }

    /**
     * Current state. An open circuit whose cooldown has elapsed reports HALF_OPEN.
     */
    public synchronized CircuitState getState() {
        switch (breaker.getState()) {
            case OPEN:
                return cooldownElapsed() ? CircuitState.HALF_OPEN : CircuitState.OPEN;
            case FORCED_OPEN:
                return CircuitState.OPEN;
            case HALF_OPEN:
                return CircuitState.HALF_OPEN;
            default:
                return CircuitState.CLOSED;
        }
    }

    /**
     * Failed calls in the current window.
     */
    public synchronized int getFailureCount() {
        return breaker.getMetrics().getNumberOfFailedCalls();
    }

    public synchronized CircuitSnapshot snapshot() {
        return CircuitSnapshot.builder()
                .provider(provider)
                .state(getState())
                .failureCount(getFailureCount())
                .openedAt(openedAt)
                .build();
    }

    public String getProvider() {
        return provider;
    }

    private synchronized void onStateTransition(CircuitBreakerOnStateTransitionEvent event) {
        generation++;
        CircuitBreaker.State to = event.getStateTransition().getToState();
        switch (to) {
            case OPEN:
                openedAt = clock.instant();
                log.warn("Circuit for {} OPENED ({})", provider, event.getStateTransition());
                break;
            case CLOSED:
                openedAt = null;
                log.info("Circuit for {} CLOSED ({})", provider, event.getStateTransition());
                break;
            default:
                log.debug("Circuit for {} moved {}", provider, event.getStateTransition());
        }
    }

    private boolean isStale(Permit permit) {
        if (permit.getGeneration() != generation) {
            log.debug("Ignoring verdict on {} from generation {} (now {})", provider, permit.getGeneration(), generation);
            return true;
        }
        return false;
    }

    private boolean cooldownElapsed() {
        return openedAt != null && clock.instant().isAfter(openedAt.plus(cooldown));
    }

    private long elapsedNanos(Permit permit) {
        return Math.max(0, Duration.between(permit.getAcquiredAt(), clock.instant()).toNanos());
    }

    /**
     * Admission to one call, valid for the circuit generation it was issued in.
     */
    @Value
    public static class Permit {
        long generation;
        Instant acquiredAt;
    }
}

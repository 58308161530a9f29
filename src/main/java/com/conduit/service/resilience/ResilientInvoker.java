package com.conduit.service.resilience;

import com.conduit.exception.CircuitOpenException;
import com.conduit.exception.DeadlineExceededException;
import com.conduit.exception.ProviderTransientException;
import com.conduit.model.CompletionRequest;
import com.conduit.model.CompletionResponse;
import com.conduit.model.GatewayEventType;
import com.conduit.provider.ProviderAdapter;
import com.conduit.service.events.GatewayEventBus;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Resilience layer: runs one provider call through its circuit breaker with bounded retries.
 *
 * Each attempt yields an {@link AttemptOutcome}. Transient failures are retried up to
 * {@code maxRetries} times with backoff, unknown failures at most once, permanent
 * failures never. Retrying stops early when the circuit opens or when the next backoff
 * would overrun the request deadline; the last failure is then surfaced as is.
 */
@Slf4j
public class ResilientInvoker {

    private final ProviderCircuitRegistry circuits;
    private final RetryPolicy retryPolicy;
    private final GatewayEventBus eventBus;

    public ResilientInvoker(ProviderCircuitRegistry circuits, RetryPolicy retryPolicy, GatewayEventBus eventBus) {
        this.circuits = circuits;
        this.retryPolicy = retryPolicy;
        this.eventBus = eventBus;
    }

    /**
     * Call the adapter under circuit breaking and retry.
     *
     * @return the response, or an error from the gateway taxonomy
     */
    public Mono<CompletionResponse> call(ProviderAdapter adapter, CompletionRequest request, Deadline deadline) {
        return attempt(adapter, request, deadline, 1, 0);
    }

    private Mono<CompletionResponse> attempt(ProviderAdapter adapter, CompletionRequest request,
                                             Deadline deadline, int attempt, int unknownFailures) {
        return Mono.defer(() -> {
            String provider = adapter.getName();
            if (deadline.isExpired()) {
                return Mono.error(new DeadlineExceededException(
                        "Deadline exceeded before attempt " + attempt + " on " + provider));
            }

            ProviderCircuit circuit = circuits.forProvider(provider);
            Optional<ProviderCircuit.Permit> permit = circuit.tryAcquirePermission();
            if (permit.isEmpty()) {
                return Mono.error(new CircuitOpenException(provider));
            }

            AtomicBoolean settled = new AtomicBoolean(false);
            return Mono.defer(() -> adapter.generate(request))
                    .switchIfEmpty(Mono.error(() -> new ProviderTransientException(provider,
                            "Provider " + provider + " returned an empty reply")))
                    .map(AttemptOutcome::success)
                    .onErrorResume(error -> Mono.just(AttemptOutcome.failure(provider, error)))
                    .doOnCancel(() -> {
                        if (settled.compareAndSet(false, true)) {
                            circuit.releasePermission(permit.get());
                            log.debug("Attempt {} on {} cancelled", attempt, provider);
                        }
                    })
                    .flatMap(outcome -> {
                        settled.set(true);
                        return settle(adapter, request, deadline, attempt, unknownFailures,
                                circuit, permit.get(), outcome);
                    });
        });
    }

    private Mono<CompletionResponse> settle(ProviderAdapter adapter, CompletionRequest request, Deadline deadline,
                                            int attempt, int unknownFailures, ProviderCircuit circuit,
                                            ProviderCircuit.Permit permit, AttemptOutcome outcome) {
        String provider = adapter.getName();

        if (outcome.isSuccess()) {
            if (circuit.onSuccess(permit)) {
                eventBus.publish(GatewayEventType.CIRCUIT_CLOSED, request.getId(), provider, null);
            }
            return Mono.just(outcome.getResponse());
        }

        if (circuit.onError(permit, outcome.getError())) {
            eventBus.publish(GatewayEventType.CIRCUIT_OPENED, request.getId(), provider,
                    outcome.getError().getMessage());
            return Mono.error(outcome.getError());
        }

        if (outcome.getFailureKind() == FailureKind.PERMANENT) {
            log.debug("Attempt {} on {} failed permanently: {}", attempt, provider, outcome.getError().getMessage());
            return Mono.error(outcome.getError());
        }

        int unknowns = outcome.getFailureKind() == FailureKind.UNKNOWN ? unknownFailures + 1 : unknownFailures;
        boolean retryable = attempt <= retryPolicy.getMaxRetries()
                && (outcome.getFailureKind() == FailureKind.TRANSIENT || unknowns <= 1);
        if (!retryable) {
            log.debug("Giving up on {} after {} attempt(s): {}", provider, attempt, outcome.getError().getMessage());
            return Mono.error(outcome.getError());
        }

        Duration delay = retryPolicy.backoff(attempt);
        if (!deadline.allows(delay)) {
            log.debug("No room before deadline to retry {} after attempt {}", provider, attempt);
            return Mono.error(outcome.getError());
        }

        log.info("Retrying {} (attempt {} failed: {}), backing off {}ms",
                provider, attempt, outcome.getError().getMessage(), delay.toMillis());
        return Mono.delay(delay)
                .then(attempt(adapter, request, deadline, attempt + 1, unknowns));
    }
}

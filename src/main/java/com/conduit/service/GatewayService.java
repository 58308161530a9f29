package com.conduit.service;

import com.conduit.exception.AllProvidersFailedException;
import com.conduit.exception.BudgetExceededException;
import com.conduit.exception.CapacityExceededException;
import com.conduit.exception.DeadlineExceededException;
import com.conduit.exception.GatewayException;
import com.conduit.exception.InvalidRequestException;
import com.conduit.model.CacheControlContext;
import com.conduit.model.CacheEntry;
import com.conduit.model.CompletionRequest;
import com.conduit.model.CompletionResponse;
import com.conduit.model.GatewayEventType;
import com.conduit.model.Message;
import com.conduit.model.ProviderDescriptor;
import com.conduit.model.TokenUsage;
import com.conduit.provider.TokenEstimator;
import com.conduit.service.cache.FingerprintGenerator;
import com.conduit.service.cache.ResponseCache;
import com.conduit.service.cost.CostLedger;
import com.conduit.service.cost.Reservation;
import com.conduit.service.events.GatewayEventBus;
import com.conduit.service.registry.ProviderLease;
import com.conduit.service.registry.ProviderRegistry;
import com.conduit.service.resilience.Deadline;
import com.conduit.service.resilience.ResilientInvoker;
import com.conduit.service.routing.LatencyTracker;
import com.conduit.service.routing.RoutingStrategy;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Gateway facade: validates a request, serves it from cache or routes it across providers
 * under budget, capacity and resilience constraints, all within the request deadline.
 */
@Slf4j
public class GatewayService {

    private final ProviderRegistry registry;
    private final ResponseCache cache;
    private final FingerprintGenerator fingerprints;
    private final RoutingStrategy routingStrategy;
    private final ResilientInvoker invoker;
    private final CostLedger ledger;
    private final LatencyTracker latencyTracker;
    private final GatewayEventBus eventBus;
    private final Clock clock;
    private final Duration defaultTimeout;
    private final boolean chargeCacheHits;

    public GatewayService(ProviderRegistry registry,
                          ResponseCache cache,
                          FingerprintGenerator fingerprints,
                          RoutingStrategy routingStrategy,
                          ResilientInvoker invoker,
                          CostLedger ledger,
                          LatencyTracker latencyTracker,
                          GatewayEventBus eventBus,
                          Clock clock,
                          Duration defaultTimeout,
                          boolean chargeCacheHits) {
        this.registry = registry;
        this.cache = cache;
        this.fingerprints = fingerprints;
        this.routingStrategy = routingStrategy;
        this.invoker = invoker;
        this.ledger = ledger;
        this.latencyTracker = latencyTracker;
        this.eventBus = eventBus;
        this.clock = clock;
        this.defaultTimeout = defaultTimeout;
        this.chargeCacheHits = chargeCacheHits;
    }

    /**
     * Process a completion request with default cache control.
     */
    public Mono<CompletionResponse> complete(CompletionRequest request) {
        return complete(request, CacheControlContext.defaults());
    }

    /**
     * Process a completion request.
     *
     * @return the response, or an error from the gateway exception hierarchy
     */
    public Mono<CompletionResponse> complete(CompletionRequest request, CacheControlContext context) {
        return Mono.defer(() -> {
            validate(request);

            CompletionRequest identified = withId(request);
            String requestId = identified.getId();
            Duration timeout = identified.getTimeoutMs() != null
                    ? Duration.ofMillis(identified.getTimeoutMs())
                    : defaultTimeout;
            Deadline deadline = Deadline.after(timeout, clock);
            long startedNanos = System.nanoTime();

            eventBus.publish(GatewayEventType.REQUEST_STARTED, requestId);
            log.debug("Request {} from {} needs {} within {}ms",
                    requestId, identified.getPrincipal(), identified.getCapabilities(), timeout.toMillis());

            return process(identified, context, deadline, startedNanos)
                    .timeout(timeout)
                    .onErrorMap(TimeoutException.class, e -> new DeadlineExceededException(
                            "Request " + requestId + " exceeded its " + timeout.toMillis() + "ms deadline", e))
                    .onErrorMap(e -> !(e instanceof GatewayException), e -> {
                        log.error("Unexpected failure processing request {}", requestId, e);
                        Map<String, Throwable> causes = new LinkedHashMap<>();
                        causes.put("gateway", e);
                        return new AllProvidersFailedException("Unexpected failure", causes);
                    });
        });
    }

    private Mono<CompletionResponse> process(CompletionRequest request, CacheControlContext context,
                                             Deadline deadline, long startedNanos) {
        String requestId = request.getId();
        String fingerprint = fingerprints.generate(request);

        if (context.shouldLookup()) {
            Optional<CacheEntry> hit = cache.get(fingerprint);
            if (hit.isPresent()) {
                return serveCached(request, hit.get(), startedNanos);
            }
            eventBus.publish(GatewayEventType.CACHE_MISS, requestId, null, fingerprint);
        } else {
            eventBus.publish(GatewayEventType.CACHE_MISS, requestId, null, "bypass");
        }

        String principal = request.getPrincipal();
        if (!ledger.hasHeadroom(principal)) {
            BigDecimal remaining = ledger.remaining(principal);
            eventBus.publish(GatewayEventType.BUDGET_EXCEEDED, requestId, null, "no headroom for " + principal);
            return Mono.error(new BudgetExceededException(principal, BigDecimal.ZERO,
                    remaining != null ? remaining : BigDecimal.ZERO));
        }

        List<ProviderDescriptor> candidates = registry.listCapable(request.getCapabilities());
        List<ProviderDescriptor> ordered = routingStrategy.selectProviders(request, candidates);
        if (ordered.isEmpty()) {
            log.warn("No healthy provider supports {} for request {}", request.getCapabilities(), requestId);
            return Mono.error(new AllProvidersFailedException(
                    "No healthy provider supports " + request.getCapabilities(), Map.of()));
        }

        log.info("Routing request {} via {}: {}", requestId, routingStrategy.getName(),
                ordered.stream().map(ProviderDescriptor::getName).collect(Collectors.toList()));
        return attemptFrom(request, fingerprint, context, ordered, 0, deadline, startedNanos, new Attempts());
    }

    private Mono<CompletionResponse> serveCached(CompletionRequest request, CacheEntry entry, long startedNanos) {
        CompletionResponse cached = entry.getResponse();
        if (chargeCacheHits) {
            chargeCacheHit(request, cached);
        }
        eventBus.publish(GatewayEventType.CACHE_HIT, request.getId(), cached.getProviderName(), entry.getFingerprint());
        log.info("Serving request {} from cache (provider={}, hits={})",
                request.getId(), cached.getProviderName(), entry.getHitCount());
        return Mono.just(cached.toBuilder()
                .requestId(request.getId())
                .latencyMs(elapsedMillis(startedNanos))
                .cached(true)
                .build());
    }

    private void chargeCacheHit(CompletionRequest request, CompletionResponse cached) {
        Optional<ProviderDescriptor> provider = registry.find(cached.getProviderName());
        if (provider.isEmpty() || cached.getUsage() == null) {
            log.debug("Not charging cache hit for {}: provider {} unknown or usage missing",
                    request.getId(), cached.getProviderName());
            return;
        }
        try {
            ledger.charge(request.getPrincipal(), ledger.actualCost(provider.get(), cached.getUsage()));
        } catch (BudgetExceededException e) {
            eventBus.publish(GatewayEventType.BUDGET_EXCEEDED, request.getId(), cached.getProviderName(), e.getMessage());
            throw e;
        }
    }

    private Mono<CompletionResponse> attemptFrom(CompletionRequest request, String fingerprint,
                                                 CacheControlContext context, List<ProviderDescriptor> ordered,
                                                 int index, Deadline deadline, long startedNanos, Attempts attempts) {
        if (index >= ordered.size()) {
            return Mono.error(attempts.exhausted());
        }

        ProviderDescriptor provider = ordered.get(index);
        return attemptProvider(request, fingerprint, context, provider, deadline, startedNanos)
                .onErrorResume(error -> {
                    if (error instanceof GatewayException && ((GatewayException) error).isCandidateLocal()) {
                        attempts.record(provider.getName(), (GatewayException) error);
                        if (index + 1 < ordered.size()) {
                            log.info("Provider {} failed for request {} ({}), falling back to {}",
                                    provider.getName(), request.getId(), error.getMessage(),
                                    ordered.get(index + 1).getName());
                        }
                        return attemptFrom(request, fingerprint, context, ordered, index + 1,
                                deadline, startedNanos, attempts);
                    }
                    return Mono.error(error);
                });
    }

    private Mono<CompletionResponse> attemptProvider(CompletionRequest request, String fingerprint,
                                                     CacheControlContext context, ProviderDescriptor provider,
                                                     Deadline deadline, long startedNanos) {
        return Mono.defer(() -> {
            String requestId = request.getId();
            String name = provider.getName();

            BigDecimal estimate = ledger.estimateCost(request, provider);
            Reservation reservation;
            try {
                reservation = ledger.reserve(request.getPrincipal(), estimate);
            } catch (BudgetExceededException e) {
                eventBus.publish(GatewayEventType.BUDGET_EXCEEDED, requestId, name, e.getMessage());
                return Mono.error(e);
            }

            ProviderLease lease;
            try {
                lease = registry.reserve(name);
            } catch (CapacityExceededException e) {
                ledger.rollback(reservation);
                eventBus.publish(GatewayEventType.PROVIDER_CALL_FAILED, requestId, name, e.getMessage());
                return Mono.error(e);
            }

            long attemptStarted = System.nanoTime();
            return invoker.call(registry.adapterFor(name), request, deadline)
                    .map(response -> {
                        latencyTracker.record(name, Duration.ofNanos(System.nanoTime() - attemptStarted));

                        TokenUsage usage = response.getUsage() != null
                                ? response.getUsage()
                                : TokenEstimator.estimateUsage(request, response.getContent());
                        BigDecimal actual = ledger.actualCost(provider, usage);
                        ledger.commit(reservation, actual);

                        CompletionResponse result = response.toBuilder()
                                .requestId(requestId)
                                .providerName(name)
                                .usage(usage)
                                .latencyMs(elapsedMillis(startedNanos))
                                .cached(false)
                                .build();
                        if (context.isStore()) {
                            cache.put(fingerprint, result);
                        }

                        eventBus.publish(GatewayEventType.PROVIDER_CALL_SUCCEEDED, requestId, name,
                                "cost=" + actual.toPlainString());
                        return result;
                    })
                    .doOnError(error -> eventBus.publish(GatewayEventType.PROVIDER_CALL_FAILED,
                            requestId, name, error.getMessage()))
                    .doFinally(signal -> {
                        lease.close();
                        ledger.rollback(reservation);
                    });
        });
    }

    private static void validate(CompletionRequest request) {
        if (request == null) {
            throw new InvalidRequestException("request is required");
        }
        if (request.getMessages() == null || request.getMessages().isEmpty()) {
            throw new InvalidRequestException("messages must not be empty");
        }
        for (int i = 0; i < request.getMessages().size(); i++) {
            Message message = request.getMessages().get(i);
            if (message == null || isBlank(message.getRole())) {
                throw new InvalidRequestException("messages[" + i + "].role is required");
            }
            if (message.getContent() == null) {
                throw new InvalidRequestException("messages[" + i + "].content is required");
            }
        }
        if (isBlank(request.getPrincipal())) {
            throw new InvalidRequestException("principal is required");
        }
        if (request.getCapabilities() == null || request.getCapabilities().isEmpty()) {
            throw new InvalidRequestException("at least one capability is required");
        }
        if (request.getMaxTokens() != null && request.getMaxTokens() <= 0) {
            throw new InvalidRequestException("max_tokens must be positive");
        }
        if (request.getTemperature() != null
                && (request.getTemperature() < 0.0 || request.getTemperature() > 2.0)) {
            throw new InvalidRequestException("temperature must be between 0 and 2");
        }
        if (request.getTimeoutMs() != null && request.getTimeoutMs() <= 0) {
            throw new InvalidRequestException("timeout_ms must be positive");
        }
    }

    private static CompletionRequest withId(CompletionRequest request) {
        if (!isBlank(request.getId())) {
            return request;
        }
        return request.toBuilder().id(UUID.randomUUID().toString()).build();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static long elapsedMillis(long startedNanos) {
        return Duration.ofNanos(System.nanoTime() - startedNanos).toMillis();
    }

    /**
     * Last error per provider for one request, in attempt order.
     */
    private static final class Attempts {
        private final Map<String, Throwable> causes = new LinkedHashMap<>();
        private int budgetSkips;
        private BudgetExceededException lastBudgetError;

        void record(String provider, GatewayException error) {
            causes.put(provider, error);
            if (error instanceof BudgetExceededException) {
                budgetSkips++;
                lastBudgetError = (BudgetExceededException) error;
            }
        }

        GatewayException exhausted() {
            if (lastBudgetError != null && budgetSkips == causes.size()) {
                return lastBudgetError;
            }
            return new AllProvidersFailedException(
                    "All " + causes.size() + " candidate provider(s) failed", causes);
        }
    }
}

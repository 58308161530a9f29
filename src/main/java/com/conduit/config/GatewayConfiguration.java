package com.conduit.config;

import com.conduit.provider.ProviderAdapterFactory;
import com.conduit.repository.RedisResponseCacheStore;
import com.conduit.service.GatewayService;
import com.conduit.service.cache.CaffeineResponseCacheStore;
import com.conduit.service.cache.FingerprintGenerator;
import com.conduit.service.cache.InMemoryResponseCacheStore;
import com.conduit.service.cache.ResponseCache;
import com.conduit.service.cache.ResponseCacheStore;
import com.conduit.service.cost.CostEstimator;
import com.conduit.service.cost.CostLedger;
import com.conduit.service.events.GatewayEventBus;
import com.conduit.service.events.GatewayEventListener;
import com.conduit.service.registry.ProviderRegistry;
import com.conduit.service.registry.RegisteredProvider;
import com.conduit.service.resilience.ProviderCircuitRegistry;
import com.conduit.service.resilience.ResilientInvoker;
import com.conduit.service.resilience.RetryPolicy;
import com.conduit.service.routing.LatencyTracker;
import com.conduit.service.routing.RoutingStrategy;
import com.conduit.service.routing.RoutingStrategyFactory;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.RedisTemplate;

import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Wires the gateway components from {@link ConduitProperties}.
 * Components are plain classes; this is the only place that knows how they fit together.
 */
@Slf4j
@Configuration
public class GatewayConfiguration {

    private final ConduitProperties properties;

    public GatewayConfiguration(ConduitProperties properties) {
        this.properties = properties;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public GatewayEventBus gatewayEventBus(Clock clock, List<GatewayEventListener> listeners) {
        GatewayEventBus bus = new GatewayEventBus(clock);
        listeners.forEach(bus::subscribe);
        log.info("Event bus started with {} listener(s)", listeners.size());
        return bus;
    }

    @Bean
    public ProviderCircuitRegistry providerCircuitRegistry(Clock clock) {
        ConduitProperties.ResilienceConfig resilience = properties.getResilience();
        return new ProviderCircuitRegistry(resilience.getFailureThreshold(), resilience.getCooldown(), clock);
    }

    @Bean
    public RetryPolicy retryPolicy() {
        ConduitProperties.ResilienceConfig resilience = properties.getResilience();
        return new RetryPolicy(
                resilience.getMaxRetries(),
                resilience.getBackoffBase(),
                resilience.getMaxBackoff(),
                resilience.getJitter());
    }

    @Bean
    public ResilientInvoker resilientInvoker(ProviderCircuitRegistry circuits, RetryPolicy retryPolicy,
                                             GatewayEventBus eventBus) {
        return new ResilientInvoker(circuits, retryPolicy, eventBus);
    }

    @Bean
    public ProviderRegistry providerRegistry(ProviderAdapterFactory adapterFactory,
                                             ProviderCircuitRegistry circuits) {
        List<RegisteredProvider> providers = properties.getProviders().stream()
                .map(config -> RegisteredProvider.builder()
                        .name(config.getName())
                        .capabilities(config.getCapabilities())
                        .costPer1kInput(config.getCostPer1kInput())
                        .costPer1kOutput(config.getCostPer1kOutput())
                        .maxConcurrency(config.getMaxConcurrency())
                        .adapter(adapterFactory.create(config))
                        .build())
                .collect(Collectors.toList());
        if (providers.isEmpty()) {
            log.warn("No providers configured under conduit.providers; every request will fail");
        }
        return new ProviderRegistry(providers, circuits);
    }

    @Bean
    public ResponseCacheStore responseCacheStore(Clock clock, ObjectMapper objectMapper,
                                                 ObjectProvider<RedisTemplate<String, byte[]>> redisTemplate) {
        ConduitProperties.CacheConfig cache = properties.getCache();
        String store = cache.getStore() == null ? "memory" : cache.getStore().toLowerCase(Locale.ROOT);
        log.info("Using '{}' response cache store (max-entries={}, default-ttl={})",
                store, cache.getMaxEntries(), cache.getDefaultTtl());

        return switch (store) {
            case "memory" -> new InMemoryResponseCacheStore(cache.getMaxEntries());
            case "caffeine" -> new CaffeineResponseCacheStore(cache.getMaxEntries(), clock);
            case "redis" -> new RedisResponseCacheStore(redisTemplate.getObject(), objectMapper, clock);
            default -> throw new IllegalArgumentException("Unknown cache store: " + cache.getStore());
        };
    }

    @Bean
    public ResponseCache responseCache(ResponseCacheStore store, Clock clock) {
        ConduitProperties.CacheConfig cache = properties.getCache();
        return new ResponseCache(store, clock, cache.getDefaultTtl(), cache.isEnabled(), cache.isRefreshTtlOnHit());
    }

    @Bean
    public FingerprintGenerator fingerprintGenerator(ObjectMapper objectMapper) {
        return new FingerprintGenerator(objectMapper);
    }

    @Bean
    public CostEstimator costEstimator() {
        return new CostEstimator(properties.getDefaultMaxTokens());
    }

    @Bean
    public CostLedger costLedger(Clock clock, CostEstimator costEstimator) {
        return new CostLedger(clock, costEstimator, properties.getBudgets(),
                properties.getDefaultLimit(), properties.getDefaultPeriod());
    }

    @Bean
    public LatencyTracker latencyTracker() {
        return new LatencyTracker(properties.getRouting().getLatencyWindow());
    }

    @Bean
    public RoutingStrategy routingStrategy(CostEstimator costEstimator, LatencyTracker latencyTracker) {
        ConduitProperties.RoutingConfig routing = properties.getRouting();
        RoutingStrategy strategy = new RoutingStrategyFactory(costEstimator, latencyTracker)
                .create(routing.getPolicy(), routing.getFallbackPolicy());
        log.info("Routing policy: {}", strategy.getName());
        return strategy;
    }

    @Bean
    public GatewayService gatewayService(ProviderRegistry registry,
                                         ResponseCache responseCache,
                                         FingerprintGenerator fingerprintGenerator,
                                         RoutingStrategy routingStrategy,
                                         ResilientInvoker resilientInvoker,
                                         CostLedger costLedger,
                                         LatencyTracker latencyTracker,
                                         GatewayEventBus eventBus,
                                         Clock clock) {
        return new GatewayService(registry, responseCache, fingerprintGenerator, routingStrategy,
                resilientInvoker, costLedger, latencyTracker, eventBus, clock,
                properties.getDefaultTimeout(), properties.getCache().isChargeCacheHits());
    }
}

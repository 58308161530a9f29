package com.conduit.controller;

import com.conduit.config.JacksonConfiguration;
import com.conduit.exception.ProviderPermanentException;
import com.conduit.model.BudgetPeriod;
import com.conduit.model.TokenUsage;
import com.conduit.service.CacheControlParser;
import com.conduit.service.GatewayService;
import com.conduit.service.cache.FingerprintGenerator;
import com.conduit.service.cache.InMemoryResponseCacheStore;
import com.conduit.service.cache.ResponseCache;
import com.conduit.service.cost.CostEstimator;
import com.conduit.service.cost.CostLedger;
import com.conduit.service.events.GatewayEventBus;
import com.conduit.service.registry.ProviderRegistry;
import com.conduit.service.registry.RegisteredProvider;
import com.conduit.service.resilience.ProviderCircuitRegistry;
import com.conduit.service.resilience.ResilientInvoker;
import com.conduit.service.resilience.RetryPolicy;
import com.conduit.service.routing.CostOptimalStrategy;
import com.conduit.service.routing.LatencyTracker;
import com.conduit.support.FakeProviderAdapter;
import com.conduit.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;

class CompletionControllerTest {

    private static final String BODY = "{\"messages\":[{\"role\":\"user\",\"content\":\"What is 2+2?\"}],"
            + "\"capabilities\":[\"chat\"],\"principal\":\"team-a\",\"max_tokens\":16}";

    private FakeProviderAdapter primary;
    private FakeProviderAdapter secondary;
    private WebTestClient client;

    @BeforeEach
    void setUp() {
        MutableClock clock = MutableClock.at("2024-05-01T10:00:00Z");
        primary = FakeProviderAdapter.named("primary").alwaysSucceed("4", TokenUsage.of(8, 1));
        secondary = FakeProviderAdapter.named("secondary")
                .alwaysFail(() -> new ProviderPermanentException("secondary", "HTTP 401"));

        GatewayEventBus eventBus = new GatewayEventBus(clock);
        ProviderCircuitRegistry breakers = new ProviderCircuitRegistry(3, Duration.ofSeconds(30), clock);
        ProviderRegistry registry = new ProviderRegistry(List.of(
                provider(primary, "chat"),
                provider(secondary, "chat", "vision")), breakers);
        CostEstimator estimator = new CostEstimator(1024);

        GatewayService gateway = new GatewayService(
                registry,
                new ResponseCache(new InMemoryResponseCacheStore(100), clock, Duration.ofHours(1)),
                new FingerprintGenerator(JacksonConfiguration.createObjectMapper()),
                new CostOptimalStrategy(estimator),
                new ResilientInvoker(breakers, new RetryPolicy(0, Duration.ofMillis(1), Duration.ofMillis(1), 0), eventBus),
                new CostLedger(clock, estimator, List.of(), null, BudgetPeriod.MONTHLY),
                new LatencyTracker(5),
                eventBus,
                clock,
                Duration.ofSeconds(5),
                false);

        client = WebTestClient.bindToController(new CompletionController(gateway, new CacheControlParser()))
                .controllerAdvice(new GatewayExceptionHandler())
                .build();
    }

    private static RegisteredProvider provider(FakeProviderAdapter adapter, String... capabilities) {
        return RegisteredProvider.builder()
                .name(adapter.getName())
                .capabilities(Set.of(capabilities))
                .costPer1kInput(new BigDecimal("0.001"))
                .costPer1kOutput(new BigDecimal("0.001"))
                .adapter(adapter)
                .build();
    }

    @Test
    void testCompletionReturnsProvenanceHeaders() {
        client.post().uri("/v1/completions")
                .contentType(MediaType.APPLICATION_JSON)
                .header("x-request-id", "client-1")
                .bodyValue(BODY)
                .exchange()
                .expectStatus().isOk()
                .expectHeader().valueEquals("x-cache-hit", "false")
                .expectHeader().valueEquals("x-provider", "primary")
                .expectHeader().valueEquals("x-request-id", "client-1")
                .expectBody()
                .jsonPath("$.content").isEqualTo("4")
                .jsonPath("$.provider_name").isEqualTo("primary")
                .jsonPath("$.usage.output_tokens").isEqualTo(1)
                .jsonPath("$.cached").isEqualTo(false);

        client.post().uri("/v1/completions")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(BODY)
                .exchange()
                .expectStatus().isOk()
                .expectHeader().valueEquals("x-cache-hit", "true");

        assertEquals(1, primary.getCalls());
    }

    @Test
    void testCacheBypassHeaderForcesProviderCall() {
        for (int i = 0; i < 2; i++) {
            client.post().uri("/v1/completions")
                    .contentType(MediaType.APPLICATION_JSON)
                    .header("x-cache-bypass", "true")
                    .bodyValue(BODY)
                    .exchange()
                    .expectStatus().isOk()
                    .expectHeader().valueEquals("x-cache-hit", "false");
        }

        assertEquals(2, primary.getCalls());
    }

    @Test
    void testInvalidRequestMapsTo400() {
        client.post().uri("/v1/completions")
                .contentType(MediaType.APPLICATION_JSON)
                .header("x-request-id", "bad-1")
                .bodyValue("{\"messages\":[],\"capabilities\":[\"chat\"],\"principal\":\"team-a\"}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error.code").isEqualTo("INVALID_REQUEST")
                .jsonPath("$.error.requestId").isEqualTo("bad-1");
    }

    @Test
    void testAllProvidersFailedMapsTo502WithCauses() {
        client.post().uri("/v1/completions")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"messages\":[{\"role\":\"user\",\"content\":\"describe\"}],"
                        + "\"capabilities\":[\"vision\"],\"principal\":\"team-a\"}")
                .exchange()
                .expectStatus().isEqualTo(502)
                .expectBody()
                .jsonPath("$.error.code").isEqualTo("ALL_PROVIDERS_FAILED")
                .jsonPath("$.error.details.causes.secondary").exists();

        assertEquals(1, secondary.getCalls());
    }
}

package com.conduit.controller;

import com.conduit.config.ConduitProperties.BudgetConfig;
import com.conduit.exception.ProviderTransientException;
import com.conduit.model.BudgetPeriod;
import com.conduit.model.CompletionResponse;
import com.conduit.model.GatewayEventType;
import com.conduit.service.cache.InMemoryResponseCacheStore;
import com.conduit.service.cache.ResponseCache;
import com.conduit.service.cost.CostEstimator;
import com.conduit.service.cost.CostLedger;
import com.conduit.service.events.GatewayEventBus;
import com.conduit.service.events.GatewayStatsCollector;
import com.conduit.service.registry.ProviderRegistry;
import com.conduit.service.registry.RegisteredProvider;
import com.conduit.service.resilience.ProviderCircuit;
import com.conduit.service.resilience.ProviderCircuitRegistry;
import com.conduit.support.FakeProviderAdapter;
import com.conduit.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AdminControllerTest {

    private ResponseCache cache;
    private WebTestClient client;

    @BeforeEach
    void setUp() {
        MutableClock clock = MutableClock.at("2024-05-01T10:00:00Z");
        ProviderCircuitRegistry breakers = new ProviderCircuitRegistry(1, Duration.ofSeconds(30), clock);
        ProviderRegistry registry = new ProviderRegistry(List.of(
                RegisteredProvider.builder().name("a").capabilities(Set.of("chat"))
                        .costPer1kInput(new BigDecimal("0.01")).adapter(FakeProviderAdapter.named("a")).build(),
                RegisteredProvider.builder().name("b").capabilities(Set.of("chat"))
                        .adapter(FakeProviderAdapter.named("b")).build()), breakers);

        ProviderCircuit circuit = breakers.forProvider("b");
        circuit.onError(circuit.tryAcquirePermission().orElseThrow(), new ProviderTransientException("b", "503"));

        BudgetConfig budget = new BudgetConfig();
        budget.setPrincipal("team-a");
        budget.setLimit(new BigDecimal("25"));
        budget.setPeriod(BudgetPeriod.DAILY);
        CostLedger ledger = new CostLedger(clock, new CostEstimator(1024), List.of(budget), null, BudgetPeriod.MONTHLY);
        ledger.charge("team-a", new BigDecimal("5"));

        cache = new ResponseCache(new InMemoryResponseCacheStore(10), clock, Duration.ofHours(1));
        cache.put("fp-1", CompletionResponse.builder().content("one").build());
        cache.put("fp-2", CompletionResponse.builder().content("two").build());

        GatewayStatsCollector stats = new GatewayStatsCollector();
        GatewayEventBus bus = new GatewayEventBus(clock);
        bus.subscribe(stats);
        bus.publish(GatewayEventType.PROVIDER_CALL_FAILED, "r1", "b", "503");

        client = WebTestClient.bindToController(new AdminController(registry, breakers, ledger, cache, stats))
                .controllerAdvice(new GatewayExceptionHandler())
                .build();
    }

    @Test
    void testListsProvidersWithCircuitState() {
        client.get().uri("/v1/admin/providers")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.providers[0].name").isEqualTo("a")
                .jsonPath("$.providers[0].health_state").isEqualTo("CLOSED")
                .jsonPath("$.providers[1].health_state").isEqualTo("OPEN")
                .jsonPath("$.circuits[0].provider").isEqualTo("b")
                .jsonPath("$.circuits[0].state").isEqualTo("OPEN");
    }

    @Test
    void testBudgetEndpoints() {
        client.get().uri("/v1/admin/budgets")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$[0].principal").isEqualTo("team-a")
                .jsonPath("$[0].period").isEqualTo("DAILY");

        client.get().uri("/v1/admin/budgets/team-a")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.spent_so_far").value(spent -> assertAmount("5", spent))
                .jsonPath("$.remaining").value(remaining -> assertAmount("20", remaining));

        client.get().uri("/v1/admin/budgets/nobody")
                .exchange()
                .expectStatus().isNotFound();
    }

    @Test
    void testStatsIncludeEventsAndCache() {
        client.get().uri("/v1/admin/stats")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.events.PROVIDER_CALL_FAILED").isEqualTo(1)
                .jsonPath("$.providers.b.PROVIDER_CALL_FAILED").isEqualTo(1)
                .jsonPath("$.cache.store").isEqualTo("memory")
                .jsonPath("$.cache.entries").isEqualTo(2);
    }

    @Test
    void testCacheInvalidationAndClear() {
        client.delete().uri("/v1/admin/cache/fp-1")
                .exchange()
                .expectStatus().isNoContent();
        client.delete().uri("/v1/admin/cache/fp-1")
                .exchange()
                .expectStatus().isNotFound();
        assertFalse(cache.get("fp-1").isPresent());

        client.delete().uri("/v1/admin/cache")
                .exchange()
                .expectStatus().isBadRequest();
        assertTrue(cache.get("fp-2").isPresent());

        client.delete().uri("/v1/admin/cache?confirm=yes")
                .exchange()
                .expectStatus().isNoContent();
        assertFalse(cache.get("fp-2").isPresent());
    }

    private static void assertAmount(String expected, Object actual) {
        assertEquals(0, new BigDecimal(expected).compareTo(new BigDecimal(actual.toString())));
    }
}

package com.conduit.controller;

import com.conduit.model.BudgetSnapshot;
import com.conduit.model.CircuitSnapshot;
import com.conduit.model.ProviderDescriptor;
import com.conduit.service.cache.CacheStats;
import com.conduit.service.cache.ResponseCache;
import com.conduit.service.cost.CostLedger;
import com.conduit.service.events.GatewayStatsCollector;
import com.conduit.service.registry.ProviderRegistry;
import com.conduit.service.resilience.ProviderCircuitRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Admin API for providers, budgets, gateway statistics and cache management.
 */
@Slf4j
@RestController
@RequestMapping("/v1/admin")
public class AdminController {

    private final ProviderRegistry providerRegistry;
    private final ProviderCircuitRegistry circuits;
    private final CostLedger costLedger;
    private final ResponseCache responseCache;
    private final GatewayStatsCollector statsCollector;

    public AdminController(ProviderRegistry providerRegistry,
                           ProviderCircuitRegistry circuits,
                           CostLedger costLedger,
                           ResponseCache responseCache,
                           GatewayStatsCollector statsCollector) {
        this.providerRegistry = providerRegistry;
        this.circuits = circuits;
        this.costLedger = costLedger;
        this.responseCache = responseCache;
        this.statsCollector = statsCollector;
    }

    /**
     * Every registered provider with its in-flight count and circuit state.
     */
    @GetMapping("/providers")
    public ResponseEntity<Map<String, Object>> getProviders() {
        List<ProviderDescriptor> providers = providerRegistry.descriptors();
        List<CircuitSnapshot> snapshots = circuits.snapshots();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("providers", providers);
        body.put("circuits", snapshots);
        return ResponseEntity.ok(body);
    }

    @GetMapping("/budgets")
    public ResponseEntity<List<BudgetSnapshot>> getBudgets() {
        return ResponseEntity.ok(costLedger.snapshots());
    }

    @GetMapping("/budgets/{principal}")
    public ResponseEntity<BudgetSnapshot> getBudget(@PathVariable String principal) {
        return costLedger.snapshot(principal)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    /**
     * Event counters (overall and per provider) plus cache statistics.
     */
    @GetMapping("/stats")
    public ResponseEntity<Map<String, Object>> getStats() {
        CacheStats cacheStats = responseCache.stats();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("events", statsCollector.totals());
        body.put("providers", statsCollector.perProvider());
        body.put("cache", cacheStats);
        return ResponseEntity.ok(body);
    }

    /**
     * Clear every cache entry.
     *
     * @param confirm must be "yes" to proceed
     */
    @DeleteMapping("/cache")
    public ResponseEntity<?> clearCache(@RequestParam(required = false) String confirm) {
        if (!"yes".equals(confirm)) {
            return ResponseEntity.badRequest()
                    .body(Map.of("error", Map.of(
                            "code", "INVALID_REQUEST",
                            "message", "Must provide confirm=yes to clear cache")));
        }

        log.warn("Admin: Clearing ALL cache entries");
        responseCache.clear();
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/cache/{fingerprint}")
    public ResponseEntity<Void> invalidate(@PathVariable String fingerprint) {
        log.info("Admin: Invalidating cache entry {}", fingerprint);
        return responseCache.invalidate(fingerprint)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }
}

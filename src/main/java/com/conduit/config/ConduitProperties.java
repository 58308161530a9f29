package com.conduit.config;

import com.conduit.model.BudgetPeriod;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Configuration properties for Conduit. Loaded once at startup.
 */
@Data
@Component
@ConfigurationProperties(prefix = "conduit")
public class ConduitProperties {

    /**
     * Providers in registration order. Order breaks routing ties.
     */
    private List<ProviderConfig> providers = new ArrayList<>();
    private RoutingConfig routing = new RoutingConfig();
    private CacheConfig cache = new CacheConfig();
    private ResilienceConfig resilience = new ResilienceConfig();
    private List<BudgetConfig> budgets = new ArrayList<>();

    /**
     * Limit applied to principals without an explicit budget. Null means unlimited.
     */
    private BigDecimal defaultLimit;
    private BudgetPeriod defaultPeriod = BudgetPeriod.MONTHLY;

    private Duration defaultTimeout = Duration.ofSeconds(60);
    private int defaultMaxTokens = 1024;

    @Data
    public static class ProviderConfig {
        private String name;
        private Set<String> capabilities = new LinkedHashSet<>();
        private BigDecimal costPer1kInput = BigDecimal.ZERO;
        private BigDecimal costPer1kOutput = BigDecimal.ZERO;
        private int maxConcurrency = 16;
        private AdapterConfig adapter = new AdapterConfig();
    }

    @Data
    public static class AdapterConfig {
        private String type = "openai";
        private String baseUrl;
        private String apiKey;
        private String model;
        private Duration timeout = Duration.ofSeconds(60);
    }

    @Data
    public static class RoutingConfig {
        private String policy = "pinned-with-fallback";
        private String fallbackPolicy = "cost-optimal";
        private int latencyWindow = 20;
    }

    @Data
    public static class CacheConfig {
        private boolean enabled = true;
        private String store = "memory";
        private int maxEntries = 10000;
        private Duration defaultTtl = Duration.ofHours(24);
        /**
         * Interval of the proactive expiry sweep. Null disables it (expiry stays lazy).
         */
        private Duration sweepInterval;
        private boolean refreshTtlOnHit = false;
        private boolean chargeCacheHits = false;
    }

    @Data
    public static class ResilienceConfig {
        private int failureThreshold = 5;
        private Duration cooldown = Duration.ofSeconds(30);
        private int maxRetries = 3;
        private Duration backoffBase = Duration.ofMillis(200);
        private Duration maxBackoff = Duration.ofSeconds(10);
        private double jitter = 0.2;
    }

    @Data
    public static class BudgetConfig {
        private String principal;
        private BigDecimal limit;
        private BudgetPeriod period = BudgetPeriod.MONTHLY;
    }
}

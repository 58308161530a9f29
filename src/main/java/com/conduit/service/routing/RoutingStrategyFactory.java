package com.conduit.service.routing;

import com.conduit.service.cost.CostEstimator;

import java.util.Locale;

/**
 * Builds the configured routing strategy by policy name.
 */
public class RoutingStrategyFactory {

    private final CostEstimator costEstimator;
    private final LatencyTracker latencyTracker;

    public RoutingStrategyFactory(CostEstimator costEstimator, LatencyTracker latencyTracker) {
        this.costEstimator = costEstimator;
        this.latencyTracker = latencyTracker;
    }

    /**
     * @param policy         cost-optimal, latency-optimal, round-robin or pinned-with-fallback
     * @param fallbackPolicy secondary order for pinned-with-fallback
     */
    public RoutingStrategy create(String policy, String fallbackPolicy) {
        String normalized = normalize(policy);
        if ("pinned-with-fallback".equals(normalized) || "pinned".equals(normalized)) {
            String secondary = normalize(fallbackPolicy);
            if (secondary.startsWith("pinned")) {
                throw new IllegalArgumentException("fallback-policy cannot itself be pinned");
            }
            return new PinnedWithFallbackStrategy(create(secondary, null));
        }

        return switch (normalized) {
            case "cost-optimal" -> new CostOptimalStrategy(costEstimator);
            case "latency-optimal" -> new LatencyOptimalStrategy(latencyTracker);
            case "round-robin" -> new RoundRobinStrategy();
            default -> throw new IllegalArgumentException("Unknown routing policy: " + policy);
        };
    }

    private static String normalize(String policy) {
        if (policy == null || policy.isBlank()) {
            return "cost-optimal";
        }
        return policy.trim().toLowerCase(Locale.ROOT).replace('_', '-');
    }
}

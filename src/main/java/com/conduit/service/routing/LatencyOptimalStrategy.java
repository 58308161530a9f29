package com.conduit.service.routing;

import com.conduit.model.CompletionRequest;
import com.conduit.model.ProviderDescriptor;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Lowest rolling-average latency first. Providers without samples score zero, so new
 * providers get probed before established ones.
 */
public class LatencyOptimalStrategy implements RoutingStrategy {

    private final LatencyTracker latencyTracker;

    public LatencyOptimalStrategy(LatencyTracker latencyTracker) {
        this.latencyTracker = latencyTracker;
    }

    @Override
    public String getName() {
        return "latency-optimal";
    }

    @Override
    public List<ProviderDescriptor> selectProviders(CompletionRequest request, List<ProviderDescriptor> candidates) {
        return candidates.stream()
                .sorted(Comparator.<ProviderDescriptor>comparingDouble(
                                provider -> latencyTracker.averageMillis(provider.getName()).orElse(0.0))
                        .thenComparingInt(ProviderDescriptor::getRegistrationOrder))
                .collect(Collectors.toList());
    }
}

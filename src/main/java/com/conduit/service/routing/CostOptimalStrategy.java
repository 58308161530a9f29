package com.conduit.service.routing;

import com.conduit.model.CompletionRequest;
import com.conduit.model.ProviderDescriptor;
import com.conduit.service.cost.CostEstimator;

import java.math.BigDecimal;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Cheapest estimated cost for the request's token profile first.
 */
public class CostOptimalStrategy implements RoutingStrategy {

    private final CostEstimator costEstimator;

    public CostOptimalStrategy(CostEstimator costEstimator) {
        this.costEstimator = costEstimator;
    }

    @Override
    public String getName() {
        return "cost-optimal";
    }

    @Override
    public List<ProviderDescriptor> selectProviders(CompletionRequest request, List<ProviderDescriptor> candidates) {
        return candidates.stream()
                .sorted(Comparator.<ProviderDescriptor, BigDecimal>comparing(
                                provider -> costEstimator.estimate(request, provider))
                        .thenComparingInt(ProviderDescriptor::getRegistrationOrder))
                .collect(Collectors.toList());
    }
}

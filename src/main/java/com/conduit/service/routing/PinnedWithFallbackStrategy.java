package com.conduit.service.routing;

import com.conduit.model.CompletionRequest;
import com.conduit.model.ProviderDescriptor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Puts the request's preferred provider first when it is a candidate; the remaining
 * providers follow the fallback strategy's order.
 */
@Slf4j
public class PinnedWithFallbackStrategy implements RoutingStrategy {

    private final RoutingStrategy fallback;

    public PinnedWithFallbackStrategy(RoutingStrategy fallback) {
        this.fallback = fallback;
    }

    @Override
    public String getName() {
        return "pinned-with-fallback(" + fallback.getName() + ")";
    }

    @Override
    public List<ProviderDescriptor> selectProviders(CompletionRequest request, List<ProviderDescriptor> candidates) {
        String preferred = request.getPreferredProvider();
        if (preferred == null || preferred.isBlank()) {
            return fallback.selectProviders(request, candidates);
        }

        Optional<ProviderDescriptor> pinned = candidates.stream()
                .filter(provider -> provider.getName().equals(preferred))
                .findFirst();
        if (pinned.isEmpty()) {
            log.info("Preferred provider '{}' is not capable or healthy, using {} order",
                    preferred, fallback.getName());
            return fallback.selectProviders(request, candidates);
        }

        List<ProviderDescriptor> rest = new ArrayList<>(candidates);
        rest.remove(pinned.get());

        List<ProviderDescriptor> ordered = new ArrayList<>(candidates.size());
        ordered.add(pinned.get());
        ordered.addAll(fallback.selectProviders(request, rest));
        return ordered;
    }
}

package com.conduit.service.routing;

import com.conduit.model.CompletionRequest;
import com.conduit.model.ProviderDescriptor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Rotates the candidate list by a shared counter, ignoring cost and latency.
 */
public class RoundRobinStrategy implements RoutingStrategy {

    private final AtomicLong counter = new AtomicLong();

    @Override
    public String getName() {
        return "round-robin";
    }

    @Override
    public List<ProviderDescriptor> selectProviders(CompletionRequest request, List<ProviderDescriptor> candidates) {
        if (candidates.isEmpty()) {
            return List.of();
        }
        List<ProviderDescriptor> ordered = new ArrayList<>(candidates);
        int offset = (int) Math.floorMod(counter.getAndIncrement(), (long) ordered.size());
        Collections.rotate(ordered, -offset);
        return ordered;
    }
}

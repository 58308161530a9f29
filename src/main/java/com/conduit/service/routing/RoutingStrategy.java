package com.conduit.service.routing;

import com.conduit.model.CompletionRequest;
import com.conduit.model.ProviderDescriptor;

import java.util.List;

/**
 * Orders candidate providers into an attempt list.
 * Candidates arrive in registration order; implementations must keep that order among
 * equal-scoring providers so routing is reproducible.
 */
public interface RoutingStrategy {

    String getName();

    /**
     * @param request    request being routed
     * @param candidates capable, healthy providers in registration order
     * @return providers to attempt, first choice first
     */
    List<ProviderDescriptor> selectProviders(CompletionRequest request, List<ProviderDescriptor> candidates);
}

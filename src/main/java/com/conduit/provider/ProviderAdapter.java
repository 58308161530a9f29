package com.conduit.provider;

import com.conduit.model.CompletionRequest;
import com.conduit.model.CompletionResponse;
import reactor.core.publisher.Mono;

/**
 * Boundary to one upstream AI service.
 * Implementations translate the canonical request into the vendor call and the vendor
 * reply (or error) back. The gateway core depends only on this interface.
 */
public interface ProviderAdapter {

    /**
     * Provider name, unique within the registry.
     *
     * @return provider name
     */
    String getName();

    /**
     * Generate a completion.
     * <p>
     * Errors must be signalled as {@link com.conduit.exception.ProviderTransientException}
     * (retryable) or {@link com.conduit.exception.ProviderPermanentException} (not retryable);
     * anything else is treated as an unknown failure. Cancelling the returned {@code Mono}
     * abandons the call.
     * <p>
     * The response must carry token usage; when the vendor omits it, use {@link TokenEstimator}.
     *
     * @param request canonical request
     * @return canonical response (not yet marked cached, latency may be zero)
     */
    Mono<CompletionResponse> generate(CompletionRequest request);
}

package com.conduit.provider;

import com.conduit.config.ConduitProperties;
import com.conduit.exception.GatewayException;
import com.conduit.exception.ProviderPermanentException;
import com.conduit.exception.ProviderTransientException;
import com.conduit.model.CompletionRequest;
import com.conduit.model.CompletionResponse;
import com.conduit.model.TokenUsage;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

/**
 * Base class for HTTP adapters: applies the per-provider timeout, fills missing usage
 * and classifies vendor failures into transient and permanent errors.
 */
@Slf4j
public abstract class AbstractHttpProviderAdapter implements ProviderAdapter {

    protected final String name;
    protected final WebClient webClient;
    protected final ObjectMapper objectMapper;
    protected final ConduitProperties.AdapterConfig config;

    protected AbstractHttpProviderAdapter(
            String name,
            WebClient webClient,
            ObjectMapper objectMapper,
            ConduitProperties.AdapterConfig config) {
        this.name = name;
        this.webClient = webClient;
        this.objectMapper = objectMapper;
        this.config = config;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public Mono<CompletionResponse> generate(CompletionRequest request) {
        return Mono.defer(() -> {
                    long startTime = System.nanoTime();
                    log.debug("Forwarding request {} to {}", request.getId(), name);
                    return exchange(request)
                            .switchIfEmpty(Mono.error(() -> new ProviderTransientException(name,
                                    "Provider " + name + " returned an empty reply")))
                            .map(body -> toResponse(request, body, (System.nanoTime() - startTime) / 1_000_000));
                })
                .timeout(config.getTimeout())
                .onErrorMap(this::classify);
    }

    /**
     * Send the vendor request and return the raw reply body.
     */
    protected abstract Mono<JsonNode> exchange(CompletionRequest request);

    /**
     * Extract the completion text from the vendor reply.
     */
    protected abstract String extractContent(JsonNode body);

    /**
     * Extract token usage from the vendor reply, or null when absent.
     */
    protected abstract TokenUsage extractUsage(JsonNode body);

    private CompletionResponse toResponse(CompletionRequest request, JsonNode body, long latencyMs) {
        String content = extractContent(body);
        if (content == null) {
            throw new ProviderTransientException(name, "Provider " + name + " returned no content");
        }

        TokenUsage usage = extractUsage(body);
        if (usage == null) {
            usage = TokenEstimator.estimateUsage(request, content);
        }

        String model = body.hasNonNull("model") ? body.get("model").asText() : config.getModel();

        return CompletionResponse.builder()
                .requestId(request.getId())
                .providerName(name)
                .model(model)
                .content(content)
                .usage(usage)
                .latencyMs(latencyMs)
                .cached(false)
                .build();
    }

    /**
     * Map a vendor/transport failure onto the gateway taxonomy.
     */
    protected Throwable classify(Throwable error) {
        if (error instanceof GatewayException) {
            return error;
        }

        if (error instanceof WebClientResponseException responseError) {
            int status = responseError.getStatusCode().value();
            String message = "Provider " + name + " returned HTTP " + status;
            if (status == 408 || status == 429 || status >= 500) {
                return new ProviderTransientException(name, message, error);
            }
            return new ProviderPermanentException(name, message, error);
        }

        if (error instanceof WebClientRequestException
                || error instanceof TimeoutException
                || error instanceof IOException) {
            return new ProviderTransientException(name,
                    "Provider " + name + " unreachable: " + error.getMessage(), error);
        }

        return ProviderTransientException.unknown(name, error);
    }

    protected static long longOrZero(JsonNode node, String field) {
        return node != null && node.hasNonNull(field) ? node.get(field).asLong() : 0L;
    }
}

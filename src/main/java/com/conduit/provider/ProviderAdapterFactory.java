package com.conduit.provider;

import com.conduit.config.ConduitProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.Locale;

/**
 * Creates adapters from provider configuration.
 */
@Slf4j
@Component
public class ProviderAdapterFactory {

    private final WebClient webClient;
    private final ObjectMapper objectMapper;

    public ProviderAdapterFactory(WebClient webClient, ObjectMapper objectMapper) {
        this.webClient = webClient;
        this.objectMapper = objectMapper;
    }

    public ProviderAdapter create(ConduitProperties.ProviderConfig provider) {
        ConduitProperties.AdapterConfig adapter = provider.getAdapter();
        if (adapter.getBaseUrl() == null || adapter.getBaseUrl().isBlank()) {
            throw new IllegalArgumentException("Provider " + provider.getName() + " has no adapter base-url");
        }

        String type = adapter.getType() == null ? "openai" : adapter.getType().toLowerCase(Locale.ROOT);
        log.info("Creating {} adapter for provider '{}' at {}", type, provider.getName(), adapter.getBaseUrl());

        return switch (type) {
            case "openai", "openai-compatible", "gemini" ->
                    new OpenAiCompatibleAdapter(provider.getName(), webClient, objectMapper, adapter);
            case "anthropic" ->
                    new AnthropicAdapter(provider.getName(), webClient, objectMapper, adapter);
            default -> throw new IllegalArgumentException(
                    "Unknown adapter type '" + adapter.getType() + "' for provider " + provider.getName());
        };
    }
}

package com.conduit.provider;

import com.conduit.config.ConduitProperties;
import com.conduit.model.CompletionRequest;
import com.conduit.model.Message;
import com.conduit.model.TokenUsage;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * Adapter for OpenAI and vendors exposing the OpenAI-compatible chat completions API
 * (Gemini's OpenAI endpoint, local inference servers).
 */
@Slf4j
public class OpenAiCompatibleAdapter extends AbstractHttpProviderAdapter {

    public OpenAiCompatibleAdapter(
            String name,
            WebClient webClient,
            ObjectMapper objectMapper,
            ConduitProperties.AdapterConfig config) {
        super(name, webClient, objectMapper, config);
    }

    @Override
    protected Mono<JsonNode> exchange(CompletionRequest request) {
        String endpoint = config.getBaseUrl() + "/chat/completions";

        WebClient.RequestBodySpec spec = webClient.post()
                .uri(endpoint)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
        if (config.getApiKey() != null && !config.getApiKey().isBlank()) {
            spec = spec.header(HttpHeaders.AUTHORIZATION, "Bearer " + config.getApiKey());
        }

        return spec.bodyValue(toVendorRequest(request).toString())
                .retrieve()
                .bodyToMono(JsonNode.class);
    }

    /**
     * Convert canonical request to the chat completions format.
     */
    JsonNode toVendorRequest(CompletionRequest request) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", config.getModel());

        ArrayNode messages = objectMapper.createArrayNode();
        for (Message msg : request.getMessages()) {
            ObjectNode vendorMsg = objectMapper.createObjectNode();
            vendorMsg.put("role", msg.getRole());
            vendorMsg.put("content", msg.getContent());
            messages.add(vendorMsg);
        }
        body.set("messages", messages);

        if (request.getMaxTokens() != null) {
            body.put("max_tokens", request.getMaxTokens());
        }
        if (request.getTemperature() != null) {
            body.put("temperature", request.getTemperature());
        }
        return body;
    }

    @Override
    protected String extractContent(JsonNode body) {
        JsonNode choices = body.get("choices");
        if (choices == null || !choices.isArray() || choices.isEmpty()) {
            return null;
        }
        JsonNode message = choices.get(0).get("message");
        if (message == null || !message.hasNonNull("content")) {
            return null;
        }
        return message.get("content").asText();
    }

    @Override
    protected TokenUsage extractUsage(JsonNode body) {
        JsonNode usage = body.get("usage");
        if (usage == null || usage.isNull()) {
            return null;
        }
        return TokenUsage.of(longOrZero(usage, "prompt_tokens"), longOrZero(usage, "completion_tokens"));
    }
}

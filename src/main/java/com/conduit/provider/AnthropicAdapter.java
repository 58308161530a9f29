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
 * Anthropic (Claude) messages API adapter.
 */
@Slf4j
public class AnthropicAdapter extends AbstractHttpProviderAdapter {

    private static final String ANTHROPIC_VERSION = "2023-06-01";
    private static final int DEFAULT_MAX_TOKENS = 4096;

    public AnthropicAdapter(
            String name,
            WebClient webClient,
            ObjectMapper objectMapper,
            ConduitProperties.AdapterConfig config) {
        super(name, webClient, objectMapper, config);
    }

    @Override
    protected Mono<JsonNode> exchange(CompletionRequest request) {
        String endpoint = config.getBaseUrl() + "/v1/messages";

        WebClient.RequestBodySpec spec = webClient.post()
                .uri(endpoint)
                .header("anthropic-version", ANTHROPIC_VERSION)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
        if (config.getApiKey() != null && !config.getApiKey().isBlank()) {
            spec = spec.header("x-api-key", config.getApiKey());
        }

        return spec.bodyValue(toVendorRequest(request).toString())
                .retrieve()
                .bodyToMono(JsonNode.class);
    }

    /**
     * Convert canonical request to Anthropic format. The system message moves to the top-level field.
     */
    JsonNode toVendorRequest(CompletionRequest request) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", config.getModel());

        String systemMessage = null;
        ArrayNode messages = objectMapper.createArrayNode();
        for (Message msg : request.getMessages()) {
            if ("system".equals(msg.getRole())) {
                systemMessage = msg.getContent();
                continue;
            }

            // Anthropic uses array of content blocks
            ObjectNode text = objectMapper.createObjectNode();
            text.put("type", "text");
            text.put("text", msg.getContent());

            ObjectNode vendorMsg = objectMapper.createObjectNode();
            vendorMsg.put("role", msg.getRole());
            vendorMsg.set("content", objectMapper.createArrayNode().add(text));
            messages.add(vendorMsg);
        }
        body.set("messages", messages);

        if (systemMessage != null) {
            body.put("system", systemMessage);
        }

        body.put("max_tokens", request.getMaxTokens() != null ? request.getMaxTokens() : DEFAULT_MAX_TOKENS);
        if (request.getTemperature() != null) {
            body.put("temperature", request.getTemperature());
        }
        return body;
    }

    @Override
    protected String extractContent(JsonNode body) {
        JsonNode content = body.get("content");
        if (content == null || !content.isArray()) {
            return null;
        }

        StringBuilder text = new StringBuilder();
        for (JsonNode block : content) {
            if ("text".equals(block.path("type").asText())) {
                text.append(block.path("text").asText());
            }
        }
        return text.toString();
    }

    @Override
    protected TokenUsage extractUsage(JsonNode body) {
        JsonNode usage = body.get("usage");
        if (usage == null || usage.isNull()) {
            return null;
        }
        return TokenUsage.of(longOrZero(usage, "input_tokens"), longOrZero(usage, "output_tokens"));
    }
}

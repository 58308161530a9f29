package com.conduit.service.cache;

import com.conduit.model.CompletionRequest;
import com.conduit.model.Message;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.apache.commons.codec.digest.DigestUtils;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.TreeSet;

/**
 * Computes the cache key of a request.
 *
 * Steps:
 * 1. Keep only the semantically relevant fields (messages, capabilities, temperature,
 *    max tokens, provider pinning); request id and principal are excluded
 * 2. Normalize whitespace in message text
 * 3. Sort capability tags and JSON keys
 * 4. Round temperature to 2 decimal places
 * 5. SHA-256 over the canonical JSON
 */
public class FingerprintGenerator {

    private static final int FLOAT_PRECISION = 2;

    private final ObjectMapper objectMapper;

    public FingerprintGenerator(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @return SHA-256 hash (64 hex chars)
     */
    public String generate(CompletionRequest request) {
        return DigestUtils.sha256Hex(canonicalize(request));
    }

    /**
     * Canonical JSON string for the request.
     */
    public String canonicalize(CompletionRequest request) {
        ObjectNode node = objectMapper.createObjectNode();

        ArrayNode messages = objectMapper.createArrayNode();
        for (Message msg : request.getMessages()) {
            ObjectNode canonicalMsg = objectMapper.createObjectNode();
            canonicalMsg.put("content", normalizeString(msg.getContent()));
            canonicalMsg.put("role", normalizeString(msg.getRole()).toLowerCase());
            messages.add(canonicalMsg);
        }
        node.set("messages", messages);

        ArrayNode capabilities = objectMapper.createArrayNode();
        new TreeSet<>(request.getCapabilities()).forEach(capabilities::add);
        node.set("capabilities", capabilities);

        if (request.getTemperature() != null) {
            node.put("temperature", BigDecimal.valueOf(request.getTemperature())
                    .setScale(FLOAT_PRECISION, RoundingMode.HALF_UP));
        }
        if (request.getMaxTokens() != null) {
            node.put("max_tokens", request.getMaxTokens());
        }
        if (request.getPreferredProvider() != null && !request.getPreferredProvider().isBlank()) {
            node.put("preferred_provider", request.getPreferredProvider().trim());
        }

        StringBuilder sb = new StringBuilder();
        serializeNode(node, sb);
        return sb.toString();
    }

    /**
     * Normalize string (trim, collapse whitespace).
     */
    private String normalizeString(String text) {
        if (text == null) {
            return "";
        }
        return text.trim().replaceAll("\\s+", " ");
    }

    // Jackson's SORT_PROPERTIES_ALPHABETICALLY doesn't apply to tree nodes, so keys are sorted here
    private void serializeNode(JsonNode node, StringBuilder sb) {
        if (node == null || node.isNull()) {
            sb.append("null");
        } else if (node.isObject()) {
            sb.append("{");
            List<String> fieldNames = new ArrayList<>();
            node.fieldNames().forEachRemaining(fieldNames::add);
            Collections.sort(fieldNames);

            boolean first = true;
            for (String fieldName : fieldNames) {
                if (!first) {
                    sb.append(",");
                }
                first = false;
                sb.append("\"").append(escapeJson(fieldName)).append("\":");
                serializeNode(node.get(fieldName), sb);
            }
            sb.append("}");
        } else if (node.isArray()) {
            sb.append("[");
            boolean first = true;
            for (JsonNode element : node) {
                if (!first) {
                    sb.append(",");
                }
                first = false;
                serializeNode(element, sb);
            }
            sb.append("]");
        } else if (node.isTextual()) {
            sb.append("\"").append(escapeJson(node.asText())).append("\"");
        } else if (node.isBigDecimal()) {
            sb.append(node.decimalValue().toPlainString());
        } else {
            sb.append(node.asText());
        }
    }

    private String escapeJson(String text) {
        return text
                .replace("\\", "\\\\")
                .replace("\"", "\\\"")
                .replace("\n", "\\n")
                .replace("\r", "\\r")
                .replace("\t", "\\t");
    }
}

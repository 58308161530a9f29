package com.conduit.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Canonical completion request accepted by the gateway.
 * Immutable once submitted; the facade only derives copies (for example to assign an id).
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CompletionRequest {

    @JsonProperty("id")
    String id;

    @Singular
    @JsonProperty("messages")
    List<Message> messages;

    /**
     * Capability tags every candidate provider must advertise (e.g. "chat", "embedding").
     */
    @Singular
    @JsonProperty("capabilities")
    Set<String> capabilities;

    /**
     * Accountable identity (user, team or API key) charged for this request.
     */
    @JsonProperty("principal")
    String principal;

    @JsonProperty("max_tokens")
    Integer maxTokens;

    @JsonProperty("temperature")
    Double temperature;

    @JsonProperty("preferred_provider")
    String preferredProvider;

    /**
     * Time budget for the whole request, measured from submission.
     */
    @JsonProperty("timeout_ms")
    Long timeoutMs;

    /**
     * Concatenated message text, used for token estimation.
     */
    @JsonIgnore
    public String promptText() {
        if (messages == null) {
            return "";
        }
        return messages.stream()
                .map(Message::getContent)
                .filter(content -> content != null)
                .collect(Collectors.joining("\n"));
    }
}

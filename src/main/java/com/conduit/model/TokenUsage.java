package com.conduit.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Token usage for one provider call.
 */
@Value
@Builder
@Jacksonized
public class TokenUsage {

    @JsonProperty("input_tokens")
    long inputTokens;

    @JsonProperty("output_tokens")
    long outputTokens;

    @JsonProperty("total_tokens")
    long totalTokens;

    public static TokenUsage of(long inputTokens, long outputTokens) {
        return TokenUsage.builder()
                .inputTokens(inputTokens)
                .outputTokens(outputTokens)
                .totalTokens(inputTokens + outputTokens)
                .build();
    }
}

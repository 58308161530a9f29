package com.conduit.provider;

import com.conduit.model.CompletionRequest;
import com.conduit.model.Message;
import com.conduit.model.TokenUsage;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class TokenEstimatorTest {

    @Test
    void testEstimateRoundsUp() {
        assertEquals(0, TokenEstimator.estimate(null));
        assertEquals(0, TokenEstimator.estimate(""));
        assertEquals(1, TokenEstimator.estimate("abc"));
        assertEquals(1, TokenEstimator.estimate("abcd"));
        assertEquals(2, TokenEstimator.estimate("abcde"));
    }

    @Test
    void testEstimateUsageCoversAllMessages() {
        CompletionRequest request = CompletionRequest.builder()
                .message(Message.of("system", "be brief"))
                .message(Message.of("user", "hello"))
                .capability("chat")
                .principal("p")
                .build();

        // "be brief\nhello" is 14 characters
        TokenUsage usage = TokenEstimator.estimateUsage(request, "12345678");

        assertEquals(4, usage.getInputTokens());
        assertEquals(2, usage.getOutputTokens());
        assertEquals(6, usage.getTotalTokens());
    }
}

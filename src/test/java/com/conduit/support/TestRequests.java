package com.conduit.support;

import com.conduit.model.CompletionRequest;
import com.conduit.model.Message;

/**
 * Request fixtures.
 */
public final class TestRequests {

    private TestRequests() {
    }

    public static CompletionRequest.CompletionRequestBuilder chat(String prompt) {
        return CompletionRequest.builder()
                .message(Message.of("user", prompt))
                .capability("chat")
                .principal("team-a");
    }
}

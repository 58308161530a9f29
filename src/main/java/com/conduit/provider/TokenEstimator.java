package com.conduit.provider;

import com.conduit.model.CompletionRequest;
import com.conduit.model.TokenUsage;

/**
 * Deterministic token estimate for vendors that do not report usage: 1 token per 4 characters, rounded up.
 */
public final class TokenEstimator {

    public static final int CHARS_PER_TOKEN = 4;

    private TokenEstimator() {
    }

    public static long estimate(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return (text.length() + CHARS_PER_TOKEN - 1) / CHARS_PER_TOKEN;
    }

    public static long estimateInput(CompletionRequest request) {
        return estimate(request.promptText());
    }

    public static TokenUsage estimateUsage(CompletionRequest request, String completion) {
        return TokenUsage.of(estimateInput(request), estimate(completion));
    }
}

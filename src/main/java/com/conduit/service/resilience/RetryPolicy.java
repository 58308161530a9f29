package com.conduit.service.resilience;

import lombok.Getter;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with jitter: {@code base * 2^(attempt-1)}, capped, plus up to
 * {@code jitter * delay} of random extra wait.
 */
@Getter
public class RetryPolicy {

    private final int maxRetries;
    private final Duration backoffBase;
    private final Duration maxBackoff;
    private final double jitter;

    public RetryPolicy(int maxRetries, Duration backoffBase, Duration maxBackoff, double jitter) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("max-retries must not be negative");
        }
        this.maxRetries = maxRetries;
        this.backoffBase = backoffBase;
        this.maxBackoff = maxBackoff;
        this.jitter = Math.max(0.0, jitter);
    }

    /**
     * Delay before the retry that follows failed attempt number {@code attempt} (1-based).
     */
    public Duration backoff(int attempt) {
        long baseMillis = backoffBase.toMillis();
        int exponent = Math.min(Math.max(0, attempt - 1), 30);
        long delay = Math.min(maxBackoff.toMillis(), baseMillis * (1L << exponent));
        if (jitter > 0 && delay > 0) {
            delay += (long) (ThreadLocalRandom.current().nextDouble() * jitter * delay);
        }
        return Duration.ofMillis(delay);
    }
}

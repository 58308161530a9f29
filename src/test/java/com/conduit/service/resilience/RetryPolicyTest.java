package com.conduit.service.resilience;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RetryPolicyTest {

    @Test
    void testExponentialBackoffIsCapped() {
        RetryPolicy policy = new RetryPolicy(5, Duration.ofMillis(100), Duration.ofMillis(500), 0.0);

        assertEquals(Duration.ofMillis(100), policy.backoff(1));
        assertEquals(Duration.ofMillis(200), policy.backoff(2));
        assertEquals(Duration.ofMillis(400), policy.backoff(3));
        assertEquals(Duration.ofMillis(500), policy.backoff(4));
        assertEquals(Duration.ofMillis(500), policy.backoff(40));
    }

    @Test
    void testJitterStaysWithinBounds() {
        RetryPolicy policy = new RetryPolicy(3, Duration.ofMillis(100), Duration.ofSeconds(10), 0.5);

        for (int i = 0; i < 100; i++) {
            long millis = policy.backoff(2).toMillis();
            assertTrue(millis >= 200 && millis <= 300, "backoff out of range: " + millis);
        }
    }

    @Test
    void testRejectsNegativeRetries() {
        assertThrows(IllegalArgumentException.class,
                () -> new RetryPolicy(-1, Duration.ofMillis(1), Duration.ofMillis(1), 0));
    }
}

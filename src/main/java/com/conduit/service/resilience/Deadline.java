package com.conduit.service.resilience;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Absolute point in time shared by every attempt of one request.
 */
public final class Deadline {

    private final Instant expiresAt;
    private final Clock clock;

    private Deadline(Instant expiresAt, Clock clock) {
        this.expiresAt = expiresAt;
        this.clock = clock;
    }

    public static Deadline after(Duration budget, Clock clock) {
        return new Deadline(clock.instant().plus(budget), clock);
    }

    public boolean isExpired() {
        return !clock.instant().isBefore(expiresAt);
    }

    /**
     * Whether waiting {@code delay} still leaves time before the deadline.
     */
    public boolean allows(Duration delay) {
        return clock.instant().plus(delay).isBefore(expiresAt);
    }
}

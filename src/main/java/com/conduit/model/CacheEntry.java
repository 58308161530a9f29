package com.conduit.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Duration;
import java.time.Instant;

/**
 * A cached provider response keyed by request fingerprint.
 * TTL is absolute from {@code createdAt}.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class CacheEntry {

    String fingerprint;

    CompletionResponse response;

    Instant createdAt;

    Duration ttl;

    long hitCount;

    @JsonIgnore
    public Instant expiresAt() {
        return createdAt.plus(ttl);
    }

    @JsonIgnore
    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt());
    }

    public CacheEntry withHit() {
        return toBuilder().hitCount(hitCount + 1).build();
    }
}

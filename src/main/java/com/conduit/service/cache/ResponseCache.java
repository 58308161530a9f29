package com.conduit.service.cache;

import com.conduit.model.CacheEntry;
import com.conduit.model.CompletionResponse;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Cache layer: stores provider responses keyed by request fingerprint.
 *
 * TTL is absolute from creation unless {@code refreshTtlOnHit} is set. Expired entries
 * are treated as misses and removed on lookup; {@link #evictExpired()} removes them
 * proactively. Store failures degrade to misses and never fail a request.
 */
@Slf4j
public class ResponseCache {

    private final ResponseCacheStore store;
    private final Clock clock;
    private final Duration defaultTtl;
    private final boolean enabled;
    private final boolean refreshTtlOnHit;

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong puts = new AtomicLong();
    private final AtomicLong expired = new AtomicLong();
    private final AtomicLong storeErrors = new AtomicLong();

    public ResponseCache(ResponseCacheStore store, Clock clock, Duration defaultTtl,
                         boolean enabled, boolean refreshTtlOnHit) {
        this.store = store;
        this.clock = clock;
        this.defaultTtl = defaultTtl;
        this.enabled = enabled;
        this.refreshTtlOnHit = refreshTtlOnHit;
        log.info("Response cache: store={}, enabled={}, default-ttl={}, refresh-ttl-on-hit={}",
                store.getName(), enabled, defaultTtl, refreshTtlOnHit);
    }

    public ResponseCache(ResponseCacheStore store, Clock clock, Duration defaultTtl) {
        this(store, clock, defaultTtl, true, false);
    }

    /**
     * Look up a live entry.
     *
     * @param fingerprint request fingerprint
     * @return the entry (with its hit count already incremented), or empty on miss
     */
    public Optional<CacheEntry> get(String fingerprint) {
        if (!enabled) {
            return Optional.empty();
        }

        try {
            Optional<CacheEntry> found = store.get(fingerprint);
            if (found.isEmpty()) {
                misses.incrementAndGet();
                log.debug("Cache MISS: {}", fingerprint);
                return Optional.empty();
            }

            Instant now = clock.instant();
            CacheEntry entry = found.get();
            if (entry.isExpired(now)) {
                if (store.removeIfExpired(fingerprint, now)) {
                    expired.incrementAndGet();
                }
                misses.incrementAndGet();
                log.debug("Cache entry expired at {}: {}", entry.expiresAt(), fingerprint);
                return Optional.empty();
            }

            CacheEntry hit = entry.withHit();
            if (refreshTtlOnHit) {
                hit = hit.toBuilder().createdAt(now).build();
            }
            store.put(hit);
            hits.incrementAndGet();
            log.debug("Cache HIT: {}, hit_count={}", fingerprint, hit.getHitCount());
            return Optional.of(hit);

        } catch (RuntimeException e) {
            storeErrors.incrementAndGet();
            misses.incrementAndGet();
            log.warn("Cache store '{}' failed on get, treating as miss: {}", store.getName(), e.getMessage());
            return Optional.empty();
        }
    }

    public void put(String fingerprint, CompletionResponse response) {
        put(fingerprint, response, defaultTtl);
    }

    public void put(String fingerprint, CompletionResponse response, Duration ttl) {
        if (!enabled) {
            return;
        }
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            log.debug("Not caching {}: non-positive ttl {}", fingerprint, ttl);
            return;
        }

        try {
            store.put(CacheEntry.builder()
                    .fingerprint(fingerprint)
                    .response(response)
                    .createdAt(clock.instant())
                    .ttl(ttl)
                    .hitCount(0)
                    .build());
            puts.incrementAndGet();
            log.debug("Cached response for {}, ttl={}", fingerprint, ttl);
        } catch (RuntimeException e) {
            storeErrors.incrementAndGet();
            log.warn("Cache store '{}' failed on put, skipping: {}", store.getName(), e.getMessage());
        }
    }

    public boolean invalidate(String fingerprint) {
        try {
            return store.remove(fingerprint);
        } catch (RuntimeException e) {
            storeErrors.incrementAndGet();
            log.warn("Cache store '{}' failed on invalidate: {}", store.getName(), e.getMessage());
            return false;
        }
    }

    public void clear() {
        try {
            store.clear();
            log.info("Cleared response cache ({})", store.getName());
        } catch (RuntimeException e) {
            storeErrors.incrementAndGet();
            log.warn("Cache store '{}' failed on clear: {}", store.getName(), e.getMessage());
        }
    }

    /**
     * Proactively remove expired entries.
     *
     * @return number of entries removed
     */
    public int evictExpired() {
        try {
            int removed = store.evictExpired(clock.instant());
            if (removed > 0) {
                expired.addAndGet(removed);
                log.debug("Expiry sweep removed {} entries", removed);
            }
            return removed;
        } catch (RuntimeException e) {
            storeErrors.incrementAndGet();
            log.warn("Cache store '{}' failed on expiry sweep: {}", store.getName(), e.getMessage());
            return 0;
        }
    }

    public CacheStats stats() {
        long size;
        long capacityEvictions;
        try {
            size = store.size();
            capacityEvictions = store.capacityEvictions();
        } catch (RuntimeException e) {
            size = -1;
            capacityEvictions = -1;
        }

        return CacheStats.builder()
                .store(store.getName())
                .entries(size)
                .hits(hits.get())
                .misses(misses.get())
                .puts(puts.get())
                .expired(expired.get())
                .capacityEvictions(capacityEvictions)
                .storeErrors(storeErrors.get())
                .build();
    }
}

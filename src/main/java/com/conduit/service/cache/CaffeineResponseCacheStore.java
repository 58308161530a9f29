package com.conduit.service.cache;

import com.conduit.model.CacheEntry;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Caffeine-backed store. Expiry follows each entry's own TTL; size eviction is Caffeine's
 * (frequency-aware, approximately LRU) policy.
 */
public class CaffeineResponseCacheStore implements ResponseCacheStore {

    private final Cache<String, CacheEntry> cache;

    public CaffeineResponseCacheStore(int maxEntries, Clock clock) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(maxEntries)
                .expireAfter(new EntryExpiry(clock))
                .recordStats()
                .build();
    }

    @Override
    public String getName() {
        return "caffeine";
    }

    @Override
    public Optional<CacheEntry> get(String fingerprint) {
        return Optional.ofNullable(cache.getIfPresent(fingerprint));
    }

    @Override
    public void put(CacheEntry entry) {
        cache.put(entry.getFingerprint(), entry);
    }

    @Override
    public boolean remove(String fingerprint) {
        return cache.asMap().remove(fingerprint) != null;
    }

    @Override
    public boolean removeIfExpired(String fingerprint, Instant now) {
        AtomicBoolean removed = new AtomicBoolean();
        cache.asMap().computeIfPresent(fingerprint, (key, current) -> {
            if (current.isExpired(now)) {
                removed.set(true);
                return null;
            }
            return current;
        });
        return removed.get();
    }

    @Override
    public void clear() {
        cache.invalidateAll();
    }

    @Override
    public long size() {
        return cache.estimatedSize();
    }

    @Override
    public int evictExpired(Instant now) {
        cache.cleanUp();
        return 0;
    }

    @Override
    public long capacityEvictions() {
        return cache.stats().evictionCount();
    }

    private static final class EntryExpiry implements Expiry<String, CacheEntry> {

        private final Clock clock;

        private EntryExpiry(Clock clock) {
            this.clock = clock;
        }

        @Override
        public long expireAfterCreate(String key, CacheEntry value, long currentTime) {
            return remainingNanos(value);
        }

        @Override
        public long expireAfterUpdate(String key, CacheEntry value, long currentTime, long currentDuration) {
            return remainingNanos(value);
        }

        @Override
        public long expireAfterRead(String key, CacheEntry value, long currentTime, long currentDuration) {
            return currentDuration;
        }

        private long remainingNanos(CacheEntry value) {
            Duration remaining = Duration.between(clock.instant(), value.expiresAt());
            return Math.max(0, remaining.toNanos());
        }
    }
}

package com.conduit.service.cache;

import com.conduit.model.CacheEntry;

import java.time.Instant;
import java.util.Optional;

/**
 * Storage backend of the response cache.
 * Implementations may throw on backend failure; {@link ResponseCache} turns that into a miss.
 */
public interface ResponseCacheStore {

    String getName();

    Optional<CacheEntry> get(String fingerprint);

    /**
     * Insert or replace the entry for its fingerprint (last writer wins).
     */
    void put(CacheEntry entry);

    boolean remove(String fingerprint);

    /**
     * Remove the entry for {@code fingerprint} only if the one currently stored is expired
     * at {@code now}. A fresh entry written concurrently is left in place.
     *
     * @return true if an expired entry was removed
     */
    boolean removeIfExpired(String fingerprint, Instant now);

    void clear();

    long size();

    /**
     * Remove entries expired at {@code now}.
     *
     * @return number of entries removed
     */
    default int evictExpired(Instant now) {
        return 0;
    }

    /**
     * Entries dropped for capacity since startup.
     */
    default long capacityEvictions() {
        return 0;
    }
}

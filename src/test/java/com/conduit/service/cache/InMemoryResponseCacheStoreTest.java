package com.conduit.service.cache;

import com.conduit.model.CacheEntry;
import com.conduit.model.CompletionResponse;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryResponseCacheStoreTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private static CacheEntry entry(String fingerprint, Duration ttl) {
        return CacheEntry.builder()
                .fingerprint(fingerprint)
                .response(CompletionResponse.builder().content("content-" + fingerprint).build())
                .createdAt(T0)
                .ttl(ttl)
                .build();
    }

    @Test
    void testEvictsLeastRecentlyUsed() {
        InMemoryResponseCacheStore store = new InMemoryResponseCacheStore(2);
        store.put(entry("a", Duration.ofHours(1)));
        store.put(entry("b", Duration.ofHours(1)));

        // touching "a" makes "b" the eviction candidate
        assertTrue(store.get("a").isPresent());
        store.put(entry("c", Duration.ofHours(1)));

        assertTrue(store.get("a").isPresent());
        assertFalse(store.get("b").isPresent());
        assertTrue(store.get("c").isPresent());
        assertEquals(2, store.size());
        assertEquals(1, store.capacityEvictions());
    }

    @Test
    void testEvictExpiredRemovesOnlyDeadEntries() {
        InMemoryResponseCacheStore store = new InMemoryResponseCacheStore(10);
        store.put(entry("short", Duration.ofMinutes(1)));
        store.put(entry("long", Duration.ofHours(1)));

        int removed = store.evictExpired(T0.plus(Duration.ofMinutes(5)));

        assertEquals(1, removed);
        assertFalse(store.get("short").isPresent());
        assertTrue(store.get("long").isPresent());
    }

    @Test
    void testRemoveAndClear() {
        InMemoryResponseCacheStore store = new InMemoryResponseCacheStore(10);
        store.put(entry("a", Duration.ofHours(1)));
        store.put(entry("b", Duration.ofHours(1)));

        assertTrue(store.remove("a"));
        assertFalse(store.remove("a"));
        store.clear();
        assertEquals(0, store.size());
    }

    @Test
    void testRemoveIfExpiredLeavesLiveEntry() {
        InMemoryResponseCacheStore store = new InMemoryResponseCacheStore(10);
        store.put(entry("short", Duration.ofMinutes(1)));
        store.put(entry("long", Duration.ofHours(1)));
        Instant later = T0.plus(Duration.ofMinutes(5));

        assertTrue(store.removeIfExpired("short", later));
        assertFalse(store.removeIfExpired("long", later));
        assertFalse(store.removeIfExpired("missing", later));
        assertTrue(store.get("long").isPresent());
        assertEquals(1, store.size());
    }
}

package com.conduit.service.cache;

import com.conduit.model.CompletionResponse;
import com.conduit.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CaffeineResponseCacheStoreTest {

    @Test
    void testWorksBehindResponseCache() {
        MutableClock clock = MutableClock.at("2024-05-01T10:00:00Z");
        CaffeineResponseCacheStore store = new CaffeineResponseCacheStore(100, clock);
        ResponseCache cache = new ResponseCache(store, clock, Duration.ofMinutes(5));

        cache.put("fp", CompletionResponse.builder().content("cached").build());
        assertEquals("caffeine", cache.stats().getStore());
        assertTrue(cache.get("fp").isPresent());

        clock.advance(Duration.ofMinutes(5));
        assertFalse(cache.get("fp").isPresent());
    }

    @Test
    void testRemoveAndClear() {
        MutableClock clock = MutableClock.at("2024-05-01T10:00:00Z");
        CaffeineResponseCacheStore store = new CaffeineResponseCacheStore(100, clock);
        ResponseCache cache = new ResponseCache(store, clock, Duration.ofMinutes(5));
        cache.put("a", CompletionResponse.builder().content("a").build());
        cache.put("b", CompletionResponse.builder().content("b").build());

        assertTrue(store.remove("a"));
        assertFalse(store.remove("a"));
        store.clear();
        assertFalse(store.get("b").isPresent());
    }

    @Test
    void testRemoveIfExpiredLeavesLiveEntry() {
        MutableClock clock = MutableClock.at("2024-05-01T10:00:00Z");
        CaffeineResponseCacheStore store = new CaffeineResponseCacheStore(100, clock);
        ResponseCache cache = new ResponseCache(store, clock, Duration.ofMinutes(5));
        cache.put("short", CompletionResponse.builder().content("short").build(), Duration.ofMinutes(1));
        cache.put("long", CompletionResponse.builder().content("long").build(), Duration.ofHours(1));
        Instant later = clock.instant().plus(Duration.ofMinutes(2));

        assertTrue(store.removeIfExpired("short", later));
        assertFalse(store.removeIfExpired("long", later));
        assertFalse(store.get("short").isPresent());
        assertTrue(store.get("long").isPresent());
    }
}

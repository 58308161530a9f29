package com.conduit.service.cache;

import com.conduit.model.CacheEntry;
import com.conduit.model.CompletionResponse;
import com.conduit.model.TokenUsage;
import com.conduit.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ResponseCacheTest {

    private MutableClock clock;
    private InMemoryResponseCacheStore store;
    private ResponseCache cache;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-05-01T10:00:00Z");
        store = new InMemoryResponseCacheStore(100);
        cache = new ResponseCache(store, clock, Duration.ofMinutes(10));
    }

    private static CompletionResponse response() {
        return CompletionResponse.builder()
                .requestId("req-1")
                .providerName("a")
                .content("Paris")
                .usage(TokenUsage.of(10, 1))
                .build();
    }

    private static CompletionResponse written(int writer) {
        return CompletionResponse.builder()
                .requestId("req-" + writer)
                .providerName("a")
                .content("writer-" + writer)
                .usage(TokenUsage.of(writer, 1))
                .build();
    }

    @Test
    void testHitIncrementsHitCount() {
        cache.put("fp", response());

        Optional<CacheEntry> first = cache.get("fp");
        Optional<CacheEntry> second = cache.get("fp");

        assertTrue(first.isPresent());
        assertEquals("Paris", first.get().getResponse().getContent());
        assertEquals(1, first.get().getHitCount());
        assertEquals(2, second.get().getHitCount());
        assertEquals(2, cache.stats().getHits());
    }

    @Test
    void testEntryIsExpiredExactlyAtCreatedPlusTtl() {
        cache.put("fp", response());

        clock.advance(Duration.ofMinutes(10).minusMillis(1));
        assertTrue(cache.get("fp").isPresent());

        clock.advance(Duration.ofMillis(1));
        assertFalse(cache.get("fp").isPresent());
        assertEquals(0, store.size());
        assertEquals(1, cache.stats().getExpired());
    }

    @Test
    void testTtlIsAbsoluteFromCreationByDefault() {
        cache.put("fp", response());

        clock.advance(Duration.ofMinutes(8));
        assertTrue(cache.get("fp").isPresent());
        clock.advance(Duration.ofMinutes(3));

        assertFalse(cache.get("fp").isPresent());
    }

    @Test
    void testRefreshTtlOnHitExtendsLifetime() {
        ResponseCache refreshing = new ResponseCache(store, clock, Duration.ofMinutes(10), true, true);
        refreshing.put("fp", response());

        clock.advance(Duration.ofMinutes(8));
        assertTrue(refreshing.get("fp").isPresent());
        clock.advance(Duration.ofMinutes(3));

        assertTrue(refreshing.get("fp").isPresent());
    }

    @Test
    void testNonPositiveTtlIsNotStored() {
        cache.put("zero", response(), Duration.ZERO);
        cache.put("negative", response(), Duration.ofSeconds(-1));

        assertEquals(0, store.size());
        assertEquals(0, cache.stats().getPuts());
    }

    @Test
    void testDisabledCacheNeverHits() {
        ResponseCache disabled = new ResponseCache(store, clock, Duration.ofMinutes(10), false, false);
        disabled.put("fp", response());

        assertFalse(disabled.get("fp").isPresent());
        assertEquals(0, store.size());
    }

    @Test
    void testStoreFailureDegradesToMiss() {
        ResponseCacheStore broken = new ResponseCacheStore() {
            @Override
            public String getName() {
                return "broken";
            }

            @Override
            public Optional<CacheEntry> get(String fingerprint) {
                throw new IllegalStateException("connection refused");
            }

            @Override
            public void put(CacheEntry entry) {
                throw new IllegalStateException("connection refused");
            }

            @Override
            public boolean remove(String fingerprint) {
                return false;
            }

            @Override
            public boolean removeIfExpired(String fingerprint, Instant now) {
                return false;
            }

            @Override
            public void clear() {
            }

            @Override
            public long size() {
                return 0;
            }
        };
        ResponseCache degraded = new ResponseCache(broken, clock, Duration.ofMinutes(10));

        degraded.put("fp", response());
        assertFalse(degraded.get("fp").isPresent());

        CacheStats stats = degraded.stats();
        assertEquals(2, stats.getStoreErrors());
        assertEquals(1, stats.getMisses());
    }

    @Test
    void testEvictExpiredCountsRemovals() {
        cache.put("a", response(), Duration.ofMinutes(1));
        cache.put("b", response(), Duration.ofMinutes(30));
        clock.advance(Duration.ofMinutes(2));

        assertEquals(1, cache.evictExpired());
        assertEquals(1, cache.stats().getEntries());
        assertTrue(cache.invalidate("b"));
        assertFalse(cache.invalidate("b"));
    }

    @Test
    void testExpiredLookupKeepsFreshEntryWrittenMeanwhile() {
        AtomicBoolean raced = new AtomicBoolean();
        InMemoryResponseCacheStore racing = new InMemoryResponseCacheStore(10) {
            @Override
            public Optional<CacheEntry> get(String fingerprint) {
                Optional<CacheEntry> stale = super.get(fingerprint);
                if (raced.compareAndSet(false, true)) {
                    // another request refreshes the entry between our read and the expiry check
                    super.put(CacheEntry.builder()
                            .fingerprint(fingerprint)
                            .response(written(2))
                            .createdAt(clock.instant())
                            .ttl(Duration.ofMinutes(10))
                            .build());
                }
                return stale;
            }
        };
        ResponseCache racy = new ResponseCache(racing, clock, Duration.ofMinutes(10));
        racy.put("fp", written(1));
        clock.advance(Duration.ofMinutes(11));

        assertFalse(racy.get("fp").isPresent());

        assertEquals(1, racing.size());
        Optional<CacheEntry> fresh = racy.get("fp");
        assertTrue(fresh.isPresent());
        assertEquals("writer-2", fresh.get().getResponse().getContent());
        assertEquals(0, racy.stats().getExpired());
    }

    @Test
    void testConcurrentPutAndGetOnOneFingerprint() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Optional<CacheEntry>>> reads = new ArrayList<>();
            List<Future<?>> writes = new ArrayList<>();
            for (int i = 0; i < 64; i++) {
                int writer = i;
                if (i % 2 == 0) {
                    writes.add(executor.submit(() -> {
                        start.await();
                        cache.put("fp", written(writer));
                        return null;
                    }));
                } else {
                    reads.add(executor.submit(() -> {
                        start.await();
                        return cache.get("fp");
                    }));
                }
            }
            start.countDown();

            for (Future<?> write : writes) {
                write.get(5, TimeUnit.SECONDS);
            }
            for (Future<Optional<CacheEntry>> read : reads) {
                Optional<CacheEntry> entry = read.get(5, TimeUnit.SECONDS);
                if (entry.isPresent()) {
                    CompletionResponse response = entry.get().getResponse();
                    String writer = response.getRequestId().substring("req-".length());
                    assertEquals("writer-" + writer, response.getContent());
                    assertEquals(Long.parseLong(writer), response.getUsage().getInputTokens());
                }
            }

            assertEquals(1, store.size());
            assertEquals(32, cache.stats().getPuts());

            cache.put("fp", written(99));
            assertEquals("writer-99", cache.get("fp").orElseThrow().getResponse().getContent());
        } finally {
            executor.shutdownNow();
        }
    }
}

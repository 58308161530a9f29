package com.conduit.repository;

import com.conduit.model.CacheEntry;
import com.conduit.service.cache.ResponseCacheStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.Set;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Redis-backed store with compression.
 * Key pattern: conduit:cache:{fingerprint}. Redis expires keys natively at the entry's TTL.
 * Failures propagate; the cache layer degrades them to misses.
 */
@Slf4j
public class RedisResponseCacheStore implements ResponseCacheStore {

    private static final String KEY_PREFIX = "conduit:cache:";

    private final RedisTemplate<String, byte[]> redisTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public RedisResponseCacheStore(RedisTemplate<String, byte[]> redisTemplate, ObjectMapper objectMapper, Clock clock) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public String getName() {
        return "redis";
    }

    @Override
    public Optional<CacheEntry> get(String fingerprint) {
        byte[] compressed = redisTemplate.opsForValue().get(buildKey(fingerprint));
        if (compressed == null) {
            return Optional.empty();
        }
        return Optional.of(decompress(compressed));
    }

    @Override
    public void put(CacheEntry entry) {
        Duration remaining = Duration.between(clock.instant(), entry.expiresAt());
        if (remaining.isNegative() || remaining.isZero()) {
            return;
        }

        byte[] compressed = compress(entry);
        redisTemplate.opsForValue().set(buildKey(entry.getFingerprint()), compressed, remaining);
        log.debug("Stored in Redis cache: key={}, ttl={}, size={}B", entry.getFingerprint(), remaining, compressed.length);
    }

    @Override
    public boolean remove(String fingerprint) {
        return Boolean.TRUE.equals(redisTemplate.delete(buildKey(fingerprint)));
    }

    /**
     * Keys carry a native TTL, so Redis drops expired entries itself.
     */
    @Override
    public boolean removeIfExpired(String fingerprint, Instant now) {
        return false;
    }

    @Override
    public void clear() {
        Set<String> keys = redisTemplate.keys(KEY_PREFIX + "*");
        if (keys != null && !keys.isEmpty()) {
            redisTemplate.delete(keys);
            log.info("Cleared {} entries from Redis cache", keys.size());
        }
    }

    @Override
    public long size() {
        Set<String> keys = redisTemplate.keys(KEY_PREFIX + "*");
        return keys == null ? 0 : keys.size();
    }

    private String buildKey(String fingerprint) {
        return KEY_PREFIX + fingerprint;
    }

    private byte[] compress(CacheEntry entry) {
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream()) {
            try (GZIPOutputStream gzipOut = new GZIPOutputStream(baos)) {
                gzipOut.write(objectMapper.writeValueAsBytes(entry));
            }
            return baos.toByteArray();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to compress cache entry", e);
        }
    }

    private CacheEntry decompress(byte[] compressed) {
        try (GZIPInputStream gzipIn = new GZIPInputStream(new ByteArrayInputStream(compressed))) {
            return objectMapper.readValue(gzipIn.readAllBytes(), CacheEntry.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to decompress cache entry", e);
        }
    }
}

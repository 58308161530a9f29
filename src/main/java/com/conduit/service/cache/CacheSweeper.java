package com.conduit.service.cache;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic expiry sweep, enabled by {@code conduit.cache.sweep-interval}.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "conduit.cache", name = "sweep-interval")
public class CacheSweeper {

    private final ResponseCache responseCache;

    public CacheSweeper(ResponseCache responseCache) {
        this.responseCache = responseCache;
    }

    @Scheduled(fixedDelayString = "${conduit.cache.sweep-interval}")
    public void sweep() {
        int removed = responseCache.evictExpired();
        log.trace("Cache sweep finished, removed={}", removed);
    }
}

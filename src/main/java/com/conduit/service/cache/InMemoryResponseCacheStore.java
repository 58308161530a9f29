package com.conduit.service.cache;

import com.conduit.model.CacheEntry;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded in-process store with strict least-recently-used eviction.
 */
@Slf4j
public class InMemoryResponseCacheStore implements ResponseCacheStore {

    private final int maxEntries;
    private final ReentrantLock lock = new ReentrantLock();
    private final LinkedHashMap<String, CacheEntry> entries;
    private long capacityEvictions;

    public InMemoryResponseCacheStore(int maxEntries) {
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("max-entries must be positive");
        }
        this.maxEntries = maxEntries;
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, CacheEntry> eldest) {
                if (size() > InMemoryResponseCacheStore.this.maxEntries) {
                    capacityEvictions++;
                    log.debug("Evicting least recently used entry {}", eldest.getKey());
                    return true;
                }
                return false;
            }
        };
    }

    @Override
    public String getName() {
        return "memory";
    }

    @Override
    public Optional<CacheEntry> get(String fingerprint) {
        lock.lock();
        try {
            return Optional.ofNullable(entries.get(fingerprint));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void put(CacheEntry entry) {
        lock.lock();
        try {
            entries.put(entry.getFingerprint(), entry);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean remove(String fingerprint) {
        lock.lock();
        try {
            return entries.remove(fingerprint) != null;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean removeIfExpired(String fingerprint, Instant now) {
        lock.lock();
        try {
            CacheEntry current = entries.get(fingerprint);
            if (current == null || !current.isExpired(now)) {
                return false;
            }
            entries.remove(fingerprint);
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void clear() {
        lock.lock();
        try {
            entries.clear();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int evictExpired(Instant now) {
        lock.lock();
        try {
            int removed = 0;
            Iterator<CacheEntry> it = entries.values().iterator();
            while (it.hasNext()) {
                if (it.next().isExpired(now)) {
                    it.remove();
                    removed++;
                }
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long capacityEvictions() {
        lock.lock();
        try {
            return capacityEvictions;
        } finally {
            lock.unlock();
        }
    }
}

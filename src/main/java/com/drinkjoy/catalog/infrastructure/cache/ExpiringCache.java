package com.drinkjoy.catalog.infrastructure.cache;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process key-value cache with per-entry TTL.
 * Expiry is discovered on read: the read that finds an expired entry removes it.
 * There is no background sweep.
 */
public class ExpiringCache<K, V> {

    private final Map<K, CacheEntry<V>> entries = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration defaultTtl;

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong expirations = new AtomicLong();

    public ExpiringCache(Clock clock, Duration defaultTtl) {
        this.clock = clock;
        this.defaultTtl = defaultTtl;
    }

    public void set(K key, V value) {
        set(key, value, defaultTtl);
    }

    public void set(K key, V value, Duration ttl) {
        entries.put(key, new CacheEntry<>(value, clock.instant(), ttl));
    }

    public Optional<V> get(K key) {
        CacheEntry<V> entry = liveEntry(key);
        if (entry == null) {
            misses.incrementAndGet();
            return Optional.empty();
        }
        hits.incrementAndGet();
        return Optional.of(entry.value());
    }

    public boolean has(K key) {
        return liveEntry(key) != null;
    }

    public void delete(K key) {
        entries.remove(key);
    }

    public void clear() {
        entries.clear();
    }

    /**
     * Number of stored entries, including expired ones not yet read
     */
    public int size() {
        return entries.size();
    }

    public CacheStats getStats() {
        return new CacheStats(hits.get(), misses.get(), expirations.get(), entries.size());
    }

    private CacheEntry<V> liveEntry(K key) {
        CacheEntry<V> entry = entries.get(key);
        if (entry == null) {
            return null;
        }
        if (entry.isExpired(clock.instant())) {
            // Only drop the entry we inspected; a concurrent set() wins
            if (entries.remove(key, entry)) {
                expirations.incrementAndGet();
            }
            return null;
        }
        return entry;
    }
}

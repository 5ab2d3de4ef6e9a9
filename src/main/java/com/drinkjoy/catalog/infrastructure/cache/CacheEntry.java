package com.drinkjoy.catalog.infrastructure.cache;

import java.time.Duration;
import java.time.Instant;

/**
 * A cached value stamped with its insertion time and time-to-live
 */
public record CacheEntry<V>(V value, Instant insertedAt, Duration ttl) {

    /**
     * Expired once strictly more than ttl has elapsed since insertion
     */
    public boolean isExpired(Instant now) {
        return Duration.between(insertedAt, now).compareTo(ttl) > 0;
    }
}

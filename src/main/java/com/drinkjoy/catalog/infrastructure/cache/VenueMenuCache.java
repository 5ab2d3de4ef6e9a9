package com.drinkjoy.catalog.infrastructure.cache;

import com.drinkjoy.catalog.domain.model.CatalogItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Capacity-bounded cache of venue menus keyed by venue id.
 * <p>
 * An entry is served only while younger than the TTL and only for the source locator
 * it was fetched from. When full, the entry with the oldest insertion time is evicted
 * before a new one is stored. Reads do not refresh an entry's position, so this is
 * eviction by insertion recency, not access recency.
 */
public class VenueMenuCache {

    private static final Logger logger = LoggerFactory.getLogger(VenueMenuCache.class);

    private final Map<String, VenueMenuCacheEntry> entries = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final Clock clock;
    private final int capacity;
    private final Duration ttl;

    public VenueMenuCache(Clock clock, int capacity, Duration ttl) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be greater than 0, got: " + capacity);
        }
        this.clock = clock;
        this.capacity = capacity;
        this.ttl = ttl;
    }

    public Optional<List<CatalogItem>> getMenu(String venueId, String sourceLocator) {
        VenueMenuCacheEntry entry = entries.get(venueId);
        if (entry == null) {
            return Optional.empty();
        }

        // The venue may have been repointed to another sheet since we cached it
        if (!entry.sourceLocator().equals(sourceLocator)) {
            logger.debug("Source locator changed for venue {} ({} -> {}), invalidating menu",
                    venueId, entry.sourceLocator(), sourceLocator);
            entries.remove(venueId, entry);
            return Optional.empty();
        }

        if (!isValid(entry, clock.instant())) {
            logger.debug("Menu cache expired for venue {}", venueId);
            entries.remove(venueId, entry);
            return Optional.empty();
        }

        return Optional.of(entry.items());
    }

    public synchronized void setMenu(String venueId, String sourceLocator, List<CatalogItem> items) {
        if (entries.size() >= capacity) {
            evictOldest();
        }
        entries.put(venueId, new VenueMenuCacheEntry(
                items, clock.instant(), sourceLocator, sequence.incrementAndGet()));
    }

    public void invalidate(String venueId) {
        if (entries.remove(venueId) != null) {
            logger.info("Cleared menu cache for venue {}", venueId);
        }
    }

    public void clearAll() {
        entries.clear();
        logger.info("Cleared all venue menu cache entries");
    }

    public MenuCacheStats stats() {
        Instant now = clock.instant();
        List<MenuCacheStats.VenueEntry> venues = entries.entrySet().stream()
                .map(e -> new MenuCacheStats.VenueEntry(
                        e.getKey(),
                        e.getValue().items().size(),
                        e.getValue().sourceLocator(),
                        e.getValue().insertedAt(),
                        Duration.between(e.getValue().insertedAt(), now).toMillis(),
                        isValid(e.getValue(), now)))
                .toList();
        return new MenuCacheStats(entries.size(), capacity, ttl, venues);
    }

    private void evictOldest() {
        entries.entrySet().stream()
                .min(Comparator.comparing((Map.Entry<String, VenueMenuCacheEntry> e) -> e.getValue().insertedAt())
                        .thenComparingLong(e -> e.getValue().sequence()))
                .ifPresent(oldest -> {
                    entries.remove(oldest.getKey());
                    logger.debug("Evicted oldest menu cache entry for venue {}", oldest.getKey());
                });
    }

    private boolean isValid(VenueMenuCacheEntry entry, Instant now) {
        return Duration.between(entry.insertedAt(), now).compareTo(ttl) < 0;
    }
}

package com.drinkjoy.catalog.infrastructure.cache;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

public record MenuCacheStats(
        int totalCachedVenues,
        int capacity,
        Duration ttl,
        List<VenueEntry> venues
) {
    public record VenueEntry(
            String venueId,
            int itemCount,
            String sourceLocator,
            Instant insertedAt,
            long ageMillis,
            boolean valid
    ) {}
}

package com.drinkjoy.catalog.infrastructure.cache;

import com.drinkjoy.catalog.domain.model.CatalogItem;

import java.time.Instant;
import java.util.List;

/**
 * A venue's menu as last fetched, with the source locator it was fetched from.
 * {@code sequence} orders entries inserted within the same clock tick.
 */
public record VenueMenuCacheEntry(
        List<CatalogItem> items,
        Instant insertedAt,
        String sourceLocator,
        long sequence
) {
    public VenueMenuCacheEntry {
        items = List.copyOf(items);
    }
}

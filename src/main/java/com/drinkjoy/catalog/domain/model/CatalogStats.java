package com.drinkjoy.catalog.domain.model;

import java.time.Instant;
import java.util.Map;

public record CatalogStats(
        int totalCount,
        Map<String, Integer> perCategoryCounts,
        Instant lastUpdated
) {
    public CatalogStats {
        perCategoryCounts = perCategoryCounts != null ? Map.copyOf(perCategoryCounts) : Map.of();
    }

    public static CatalogStats empty() {
        return new CatalogStats(0, Map.of(), null);
    }

    public boolean isEmpty() {
        return totalCount == 0;
    }
}

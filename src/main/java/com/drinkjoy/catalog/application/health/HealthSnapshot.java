package com.drinkjoy.catalog.application.health;

import com.drinkjoy.catalog.domain.model.CatalogStats;
import com.drinkjoy.catalog.domain.model.SyncMetadata;

/**
 * Everything the evaluator looks at, captured at one point in time.
 * {@code metadata} is null when the source has never been synced.
 */
public record HealthSnapshot(
        boolean running,
        boolean syncing,
        int consecutiveErrors,
        boolean storeFresh,
        CatalogStats stats,
        SyncMetadata metadata,
        boolean sourceIdConfigured,
        boolean apiKeyConfigured
) {}

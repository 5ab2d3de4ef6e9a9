package com.drinkjoy.catalog.domain.model;

import java.time.Instant;
import java.util.Map;

/**
 * Bookkeeping for one external source. Only the sync scheduler writes it.
 */
public record SyncMetadata(
        String sourceId,
        SyncStatus status,
        Instant lastAttempt,
        Instant lastSuccess,
        int consecutiveErrors,
        Map<String, Integer> perCategoryCounts,
        int totalItems,
        String lastErrorMessage
) {
    public SyncMetadata {
        perCategoryCounts = perCategoryCounts != null ? Map.copyOf(perCategoryCounts) : Map.of();
    }

    public static SyncMetadata initial(String sourceId) {
        return new SyncMetadata(sourceId, SyncStatus.IDLE, null, null, 0, Map.of(), 0, null);
    }

    public SyncMetadata syncing(Instant attemptedAt) {
        return new SyncMetadata(sourceId, SyncStatus.SYNCING, attemptedAt, lastSuccess,
                consecutiveErrors, perCategoryCounts, totalItems, lastErrorMessage);
    }

    public SyncMetadata succeeded(Instant completedAt, Map<String, Integer> counts, int total) {
        return new SyncMetadata(sourceId, SyncStatus.SUCCESS, lastAttempt, completedAt,
                0, counts, total, null);
    }

    public SyncMetadata failed(Instant failedAt, int errors, String errorMessage) {
        return new SyncMetadata(sourceId, SyncStatus.ERROR, failedAt, lastSuccess,
                errors, perCategoryCounts, totalItems, errorMessage);
    }

    /**
     * Status after an attempt that found the catalog already fresh
     */
    public SyncMetadata unchanged(Instant attemptedAt) {
        SyncStatus restored = status == SyncStatus.SYNCING ? SyncStatus.IDLE : status;
        return new SyncMetadata(sourceId, restored, attemptedAt, lastSuccess,
                0, perCategoryCounts, totalItems, lastErrorMessage);
    }
}

package com.drinkjoy.catalog.application;

import java.util.Map;

/**
 * What one synchronization pass did
 */
public record SyncOutcome(
        boolean skipped,
        String reason,
        int totalItems,
        Map<String, Integer> categoryCounts,
        long durationMillis
) {
    public SyncOutcome {
        categoryCounts = categoryCounts != null ? Map.copyOf(categoryCounts) : Map.of();
    }

    public static SyncOutcome skipped(String reason, long durationMillis) {
        return new SyncOutcome(true, reason, 0, Map.of(), durationMillis);
    }

    public static SyncOutcome completed(int totalItems, Map<String, Integer> categoryCounts, long durationMillis) {
        return new SyncOutcome(false, null, totalItems, categoryCounts, durationMillis);
    }
}

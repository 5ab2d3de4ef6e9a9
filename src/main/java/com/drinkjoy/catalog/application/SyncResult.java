package com.drinkjoy.catalog.application;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of a sync request as reported to callers of the scheduler
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SyncResult(
        boolean success,
        boolean skipped,
        String message,
        Map<String, Object> data
) {
    public static SyncResult alreadyInProgress() {
        return new SyncResult(false, false, "Sync already in progress", null);
    }

    public static SyncResult skipped(String reason) {
        return new SyncResult(true, true, reason, null);
    }

    public static SyncResult completed(SyncOutcome outcome) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("totalItems", outcome.totalItems());
        data.put("categoryCounts", outcome.categoryCounts());
        data.put("durationMs", outcome.durationMillis());
        return new SyncResult(true, false, "Sync completed successfully", data);
    }

    public static SyncResult failed(String errorMessage) {
        return new SyncResult(false, false, "Sync failed: " + errorMessage, null);
    }
}

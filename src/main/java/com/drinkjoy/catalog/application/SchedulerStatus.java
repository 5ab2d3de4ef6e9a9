package com.drinkjoy.catalog.application;

public record SchedulerStatus(
        boolean running,
        boolean syncing,
        int consecutiveErrors,
        Config config
) {
    public record Config(
            boolean enabled,
            String sourceId,
            long intervalSeconds,
            int maxAttempts,
            long retryDelaySeconds,
            int errorThreshold
    ) {}
}

package com.drinkjoy.catalog.infrastructure.web.dto;

import com.drinkjoy.catalog.application.MonitoringReport;
import com.drinkjoy.catalog.application.SchedulerStatus;
import com.drinkjoy.catalog.application.health.Alert;
import com.drinkjoy.catalog.application.health.HealthStatus;
import com.drinkjoy.catalog.domain.model.CatalogStats;
import com.drinkjoy.catalog.domain.model.SyncMetadata;
import com.drinkjoy.catalog.infrastructure.cache.CacheStats;
import com.drinkjoy.catalog.infrastructure.cache.MenuCacheStats;

import java.time.Instant;
import java.util.List;

public record AdminStatusResponse(
        SchedulerStatus polling,
        CacheSection cache,
        MenuCacheStats menuCache,
        SyncMetadata sourceMetadata,
        HealthSection health,
        List<Alert> alerts,
        Instant timestamp
) {
    public static AdminStatusResponse from(MonitoringReport report, CacheStats memoryCache, MenuCacheStats menuCache) {
        return new AdminStatusResponse(
                report.polling(),
                new CacheSection(report.catalog(), memoryCache),
                menuCache,
                report.sourceMetadata(),
                new HealthSection(report.health().score(), report.health().status(), report.health().cacheHealthy()),
                report.health().alerts(),
                report.timestamp()
        );
    }

    public record CacheSection(
            CatalogStats store,
            CacheStats memory
    ) {}

    public record HealthSection(
            int score,
            HealthStatus status,
            boolean cacheHealthy
    ) {}
}

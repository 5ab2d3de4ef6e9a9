package com.drinkjoy.catalog.application;

import com.drinkjoy.catalog.application.health.HealthReport;
import com.drinkjoy.catalog.domain.model.CatalogStats;
import com.drinkjoy.catalog.domain.model.SyncMetadata;

import java.time.Instant;

/**
 * Point-in-time view of the sync pipeline. {@code sourceMetadata} is null before the first sync.
 */
public record MonitoringReport(
        SchedulerStatus polling,
        CatalogStats catalog,
        SyncMetadata sourceMetadata,
        HealthReport health,
        Instant timestamp
) {}

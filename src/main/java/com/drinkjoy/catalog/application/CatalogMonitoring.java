package com.drinkjoy.catalog.application;

import com.drinkjoy.catalog.application.health.HealthReport;
import com.drinkjoy.catalog.application.health.HealthSnapshot;
import com.drinkjoy.catalog.application.health.SyncHealthEvaluator;
import com.drinkjoy.catalog.domain.model.CatalogStats;
import com.drinkjoy.catalog.domain.model.SyncMetadata;
import com.drinkjoy.catalog.domain.port.out.CatalogRepository;
import com.drinkjoy.catalog.domain.port.out.SyncMetadataRepository;
import com.drinkjoy.catalog.infrastructure.config.SourceProperties;
import com.drinkjoy.catalog.infrastructure.config.SyncProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;

@Service
public class CatalogMonitoring {

    private static final Logger logger = LoggerFactory.getLogger(CatalogMonitoring.class);

    private final CatalogSyncControl syncControl;
    private final CatalogRepository catalogRepository;
    private final SyncMetadataRepository metadataRepository;
    private final SyncHealthEvaluator healthEvaluator;
    private final SyncProperties syncProperties;
    private final SourceProperties sourceProperties;
    private final Clock clock;

    public CatalogMonitoring(CatalogSyncControl syncControl,
                             CatalogRepository catalogRepository,
                             SyncMetadataRepository metadataRepository,
                             SyncHealthEvaluator healthEvaluator,
                             SyncProperties syncProperties,
                             SourceProperties sourceProperties,
                             Clock clock) {
        this.syncControl = syncControl;
        this.catalogRepository = catalogRepository;
        this.metadataRepository = metadataRepository;
        this.healthEvaluator = healthEvaluator;
        this.syncProperties = syncProperties;
        this.sourceProperties = sourceProperties;
        this.clock = clock;
    }

    public MonitoringReport report() {
        SchedulerStatus polling = syncControl.getStatus();
        CatalogStats stats = catalogRepository.getStats();
        boolean storeFresh = catalogRepository.isHealthy(syncProperties.getHealthMaxAgeMinutes());
        SyncMetadata metadata = syncProperties.hasSourceId()
                ? metadataRepository.find(syncProperties.getSourceId()).orElse(null)
                : null;

        HealthReport health = healthEvaluator.evaluate(new HealthSnapshot(
                polling.running(),
                polling.syncing(),
                polling.consecutiveErrors(),
                storeFresh,
                stats,
                metadata,
                syncProperties.hasSourceId(),
                sourceProperties.hasApiKey()
        ));

        logger.debug("Catalog health: score={}, status={}, alerts={}",
                health.score(), health.status(), health.alerts().size());
        return new MonitoringReport(polling, stats, metadata, health, clock.instant());
    }
}

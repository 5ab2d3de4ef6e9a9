package com.drinkjoy.catalog.application;

import com.drinkjoy.catalog.application.health.Alert;
import com.drinkjoy.catalog.application.health.HealthStatus;
import com.drinkjoy.catalog.application.health.SyncHealthEvaluator;
import com.drinkjoy.catalog.domain.model.CatalogStats;
import com.drinkjoy.catalog.domain.model.SyncMetadata;
import com.drinkjoy.catalog.domain.port.out.CatalogRepository;
import com.drinkjoy.catalog.domain.port.out.SyncMetadataRepository;
import com.drinkjoy.catalog.infrastructure.config.SourceProperties;
import com.drinkjoy.catalog.infrastructure.config.SyncProperties;
import com.drinkjoy.catalog.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CatalogMonitoringTest {

    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    @Mock
    private CatalogSyncControl syncControl;

    @Mock
    private CatalogRepository catalogRepository;

    @Mock
    private SyncMetadataRepository metadataRepository;

    private SyncProperties syncProperties;
    private SourceProperties sourceProperties;
    private CatalogMonitoring monitoring;

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock(NOW);
        syncProperties = new SyncProperties();
        syncProperties.setSourceId("sheet-1");
        sourceProperties = new SourceProperties();
        sourceProperties.setApiKey("key");
        monitoring = new CatalogMonitoring(syncControl, catalogRepository, metadataRepository,
                new SyncHealthEvaluator(clock), syncProperties, sourceProperties, clock);
    }

    @Test
    void shouldAssembleReportFromAllSources() {
        // Given
        SchedulerStatus polling = new SchedulerStatus(true, false, 0,
                new SchedulerStatus.Config(true, "sheet-1", 60, 3, 5, 5));
        CatalogStats stats = new CatalogStats(30, Map.of("beer", 10, "wine", 10, "spirit", 10), NOW);
        SyncMetadata metadata = SyncMetadata.initial("sheet-1").syncing(NOW).succeeded(NOW, stats.perCategoryCounts(), 30);

        when(syncControl.getStatus()).thenReturn(polling);
        when(catalogRepository.getStats()).thenReturn(stats);
        when(catalogRepository.isHealthy(30)).thenReturn(true);
        when(metadataRepository.find("sheet-1")).thenReturn(Optional.of(metadata));

        // When
        MonitoringReport report = monitoring.report();

        // Then
        assertThat(report.polling()).isEqualTo(polling);
        assertThat(report.catalog()).isEqualTo(stats);
        assertThat(report.sourceMetadata()).isEqualTo(metadata);
        assertThat(report.health().score()).isEqualTo(100);
        assertThat(report.health().status()).isEqualTo(HealthStatus.HEALTHY);
        assertThat(report.timestamp()).isEqualTo(NOW);
    }

    @Test
    void shouldReportMissingConfiguration() {
        // Given
        syncProperties.setSourceId(null);
        sourceProperties.setApiKey("");
        when(syncControl.getStatus()).thenReturn(new SchedulerStatus(false, false, 0,
                new SchedulerStatus.Config(true, null, 60, 3, 5, 5)));
        when(catalogRepository.getStats()).thenReturn(CatalogStats.empty());

        // When
        MonitoringReport report = monitoring.report();

        // Then
        assertThat(report.sourceMetadata()).isNull();
        assertThat(report.health().status()).isEqualTo(HealthStatus.CRITICAL);
        assertThat(report.health().alerts()).extracting(Alert::message)
                .contains("Catalog source id is not configured", "Source API key is not configured");
        verifyNoInteractions(metadataRepository);
    }
}

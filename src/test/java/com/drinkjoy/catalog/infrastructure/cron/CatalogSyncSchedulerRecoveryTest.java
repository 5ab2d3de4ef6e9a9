package com.drinkjoy.catalog.infrastructure.cron;

import com.drinkjoy.catalog.application.SyncCatalog;
import com.drinkjoy.catalog.application.SyncResult;
import com.drinkjoy.catalog.domain.model.CatalogItem;
import com.drinkjoy.catalog.domain.model.DrinkCategory;
import com.drinkjoy.catalog.domain.model.SyncMetadata;
import com.drinkjoy.catalog.domain.model.SyncStatus;
import com.drinkjoy.catalog.domain.port.out.CatalogSource;
import com.drinkjoy.catalog.domain.port.out.SyncMetadataRepository;
import com.drinkjoy.catalog.infrastructure.config.SyncProperties;
import com.drinkjoy.catalog.infrastructure.persistence.JdbcCatalogRepository;
import com.drinkjoy.catalog.support.MutableClock;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.flywaydb.core.Flyway;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Scheduler over a real H2 catalog store where a failing replace leaves the first batch behind
 */
class CatalogSyncSchedulerRecoveryTest {

    private MutableClock clock;
    private JdbcCatalogRepository repository;
    private CatalogSource catalogSource;
    private InMemorySyncMetadataRepository metadataRepository;
    private CatalogSyncScheduler scheduler;

    @BeforeEach
    void setUp() {
        JdbcDataSource dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:recovery_" + System.nanoTime()
                + ";MODE=PostgreSQL;DB_CLOSE_DELAY=-1");
        dataSource.setUser("sa");
        dataSource.setPassword("");
        Flyway.configure().dataSource(dataSource).load().migrate();

        clock = new MutableClock(Instant.parse("2024-06-01T18:00:00Z"));
        repository = new JdbcCatalogRepository(new JdbcTemplate(dataSource), new ObjectMapper(), clock);

        SyncProperties properties = new SyncProperties();
        properties.setSourceId("sheet-1");
        properties.setInterval(Duration.ofSeconds(60));
        properties.setMaxAttempts(1);
        properties.setRetryDelay(Duration.ofMillis(1));
        properties.setErrorThreshold(5);

        catalogSource = mock(CatalogSource.class);
        metadataRepository = new InMemorySyncMetadataRepository();

        TaskScheduler taskScheduler = mock(TaskScheduler.class);
        ScheduledFuture<?> future = mock(ScheduledFuture.class);
        doReturn(future).when(taskScheduler)
                .scheduleAtFixedRate(any(Runnable.class), any(Instant.class), any(Duration.class));

        scheduler = new CatalogSyncScheduler(new SyncCatalog(catalogSource, repository, properties),
                metadataRepository, properties, taskScheduler, clock);
    }

    @Test
    void shouldOpenCircuitWhenEveryReplaceFailsPartway() {
        // Given
        when(catalogSource.fetchAll()).thenReturn(catalogBrokenInSecondBatch());
        scheduler.start();

        // When
        List<SyncResult> results = new ArrayList<>();
        for (int tick = 0; tick < 5; tick++) {
            results.add(scheduler.performSync());
            clock.advance(Duration.ofSeconds(30));
        }

        // Then
        assertThat(results).allSatisfy(result -> {
            assertThat(result.success()).isFalse();
            assertThat(result.skipped()).isFalse();
        });
        assertThat(scheduler.isRunning()).isFalse();
        assertThat(scheduler.getStatus().consecutiveErrors()).isEqualTo(5);
        verify(catalogSource, times(5)).fetchAll();

        SyncMetadata metadata = metadataRepository.find("sheet-1").orElseThrow();
        assertThat(metadata.status()).isEqualTo(SyncStatus.ERROR);
        assertThat(metadata.consecutiveErrors()).isEqualTo(5);

        // The first batch survived each failed replace
        assertThat(repository.getStats().totalCount()).isBetween(1, 149);
        assertThat(repository.isHealthy(1)).isTrue();
    }

    @Test
    void shouldResyncOnNextTickAfterPartialWrite() {
        // Given
        when(catalogSource.fetchAll())
                .thenReturn(catalogBrokenInSecondBatch())
                .thenReturn(catalog(150));
        scheduler.performSync();
        clock.advance(Duration.ofSeconds(30));

        // When
        SyncResult result = scheduler.performSync();

        // Then
        assertThat(result.success()).isTrue();
        assertThat(result.skipped()).isFalse();
        assertThat(repository.getStats().totalCount()).isEqualTo(150);
        assertThat(scheduler.getStatus().consecutiveErrors()).isZero();
        assertThat(metadataRepository.find("sheet-1").orElseThrow().status()).isEqualTo(SyncStatus.SUCCESS);
    }

    @Test
    void shouldStillSkipWhenLastSyncSucceeded() {
        // Given
        when(catalogSource.fetchAll()).thenReturn(catalog(150));
        scheduler.performSync();
        clock.advance(Duration.ofSeconds(30));

        // When
        SyncResult result = scheduler.performSync();

        // Then
        assertThat(result.skipped()).isTrue();
        verify(catalogSource, times(1)).fetchAll();
    }

    private static List<CatalogItem> catalog(int size) {
        return IntStream.range(0, size)
                .mapToObj(i -> CatalogItem.of("beer-" + i, "Beer " + i, DrinkCategory.BEER))
                .toList();
    }

    // A duplicate id at position 120 fails the second insert batch after the first one is written
    private static List<CatalogItem> catalogBrokenInSecondBatch() {
        List<CatalogItem> items = new ArrayList<>(catalog(150));
        items.set(120, CatalogItem.of("beer-110", "Beer 110 again", DrinkCategory.BEER));
        return items;
    }

    private static class InMemorySyncMetadataRepository implements SyncMetadataRepository {

        private final Map<String, SyncMetadata> store = new HashMap<>();

        @Override
        public Optional<SyncMetadata> find(String sourceId) {
            return Optional.ofNullable(store.get(sourceId));
        }

        @Override
        public void save(SyncMetadata metadata) {
            store.put(metadata.sourceId(), metadata);
        }
    }
}

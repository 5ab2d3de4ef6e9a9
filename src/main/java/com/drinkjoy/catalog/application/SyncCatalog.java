package com.drinkjoy.catalog.application;

import com.drinkjoy.catalog.domain.exception.PersistenceFailureException;
import com.drinkjoy.catalog.domain.exception.SourceUnavailableException;
import com.drinkjoy.catalog.domain.model.CatalogItem;
import com.drinkjoy.catalog.domain.port.out.CatalogRepository;
import com.drinkjoy.catalog.domain.port.out.CatalogSource;
import com.drinkjoy.catalog.infrastructure.config.SyncProperties;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * One synchronization pass: staleness check, fetch with retry, full replace.
 * Scheduling, single-flight and error counting belong to the caller.
 */
@Service
public class SyncCatalog {

    private static final Logger logger = LoggerFactory.getLogger(SyncCatalog.class);

    private final CatalogSource catalogSource;
    private final CatalogRepository catalogRepository;
    private final SyncProperties syncProperties;
    private final Retry fetchRetry;

    public SyncCatalog(CatalogSource catalogSource,
                       CatalogRepository catalogRepository,
                       SyncProperties syncProperties) {
        this.catalogSource = catalogSource;
        this.catalogRepository = catalogRepository;
        this.syncProperties = syncProperties;
        this.fetchRetry = Retry.of("catalog-source", RetryConfig.custom()
                .maxAttempts(Math.max(1, syncProperties.getMaxAttempts()))
                .waitDuration(syncProperties.getRetryDelay())
                .build());
        this.fetchRetry.getEventPublisher()
                .onRetry(event -> logger.warn("Fetch attempt {}/{} for source {} failed: {}",
                        event.getNumberOfRetryAttempts(), syncProperties.getMaxAttempts(),
                        syncProperties.getSourceId(), describe(event.getLastThrowable())));
    }

    /**
     * A sync is needed unless the store is non-empty and younger than one sync interval
     */
    public boolean shouldSync() {
        long maxAgeMinutes = Math.max(1, syncProperties.getInterval().toMinutes());
        try {
            return !catalogRepository.isHealthy(maxAgeMinutes);
        } catch (Exception e) {
            logger.warn("Could not check catalog freshness, syncing anyway: {}", e.getMessage());
            return true;
        }
    }

    /**
     * Fetch the full catalog, retrying with a fixed delay. The last failure is rethrown.
     */
    public List<CatalogItem> fetchWithRetry() {
        return Retry.decorateSupplier(fetchRetry, () -> {
            List<CatalogItem> items = catalogSource.fetchAll();
            if (items == null || items.isEmpty()) {
                throw new SourceUnavailableException("no data");
            }
            return items;
        }).get();
    }

    /**
     * @param forceRefresh skip the staleness check, used after a failed attempt since
     *                     a partial write leaves fresh rows behind
     */
    public SyncOutcome synchronize(boolean forceRefresh) {
        long startedAt = System.currentTimeMillis();

        if (!forceRefresh && !shouldSync()) {
            logger.info("Catalog is fresh, skipping sync for source {}", syncProperties.getSourceId());
            return SyncOutcome.skipped("Catalog is up to date", System.currentTimeMillis() - startedAt);
        }

        logger.info("Starting catalog sync for source {}", syncProperties.getSourceId());
        List<CatalogItem> items = fetchWithRetry();

        if (!catalogRepository.replaceAll(items)) {
            throw new PersistenceFailureException("Failed to store " + items.size() + " catalog items");
        }

        Map<String, Integer> counts = countByCategory(items);
        long duration = System.currentTimeMillis() - startedAt;
        logger.info("Catalog sync stored {} items in {}ms: {}", items.size(), duration, counts);
        return SyncOutcome.completed(items.size(), counts, duration);
    }

    static Map<String, Integer> countByCategory(List<CatalogItem> items) {
        Map<String, Integer> counts = new TreeMap<>();
        for (CatalogItem item : items) {
            counts.merge(item.category().value(), 1, Integer::sum);
        }
        return counts;
    }

    private static String describe(Throwable error) {
        return error != null ? error.getMessage() : "unknown error";
    }
}

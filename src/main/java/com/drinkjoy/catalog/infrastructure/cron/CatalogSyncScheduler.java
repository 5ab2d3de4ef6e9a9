package com.drinkjoy.catalog.infrastructure.cron;

import com.drinkjoy.catalog.application.CatalogSyncControl;
import com.drinkjoy.catalog.application.SchedulerStatus;
import com.drinkjoy.catalog.application.SyncCatalog;
import com.drinkjoy.catalog.application.SyncOutcome;
import com.drinkjoy.catalog.application.SyncResult;
import com.drinkjoy.catalog.domain.model.SyncMetadata;
import com.drinkjoy.catalog.domain.model.SyncStatus;
import com.drinkjoy.catalog.domain.port.out.SyncMetadataRepository;
import com.drinkjoy.catalog.infrastructure.config.SyncProperties;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Periodic catalog synchronization with single-flight and an error circuit breaker.
 * <p>
 * After {@code error-threshold} consecutive failures the timer is cancelled and stays
 * cancelled until an operator calls {@link #start()} again. Manual syncs still run
 * while stopped and reset the error count on success.
 */
@Service
public class CatalogSyncScheduler implements CatalogSyncControl {

    private static final Logger logger = LoggerFactory.getLogger(CatalogSyncScheduler.class);
    static final String MISSING_SOURCE_ID = "Catalog source id is not configured";

    private final SyncCatalog syncCatalog;
    private final SyncMetadataRepository metadataRepository;
    private final SyncProperties properties;
    private final TaskScheduler taskScheduler;
    private final Clock clock;

    private final AtomicBoolean syncing = new AtomicBoolean(false);
    private final AtomicInteger consecutiveErrors = new AtomicInteger(0);
    private volatile ScheduledFuture<?> scheduledSync;

    public CatalogSyncScheduler(SyncCatalog syncCatalog,
                                SyncMetadataRepository metadataRepository,
                                SyncProperties properties,
                                @Qualifier("catalogSyncTaskScheduler") TaskScheduler taskScheduler,
                                Clock clock) {
        this.syncCatalog = syncCatalog;
        this.metadataRepository = metadataRepository;
        this.properties = properties;
        this.taskScheduler = taskScheduler;
        this.clock = clock;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void startOnReady() {
        if (properties.isAutoStart()) {
            start();
        } else {
            logger.info("Catalog sync auto-start disabled, waiting for an explicit start");
        }
    }

    @Override
    public synchronized void start() {
        if (isRunning()) {
            logger.debug("Catalog sync already running");
            return;
        }
        if (!properties.isEnabled()) {
            logger.info("Catalog sync is disabled, not starting");
            return;
        }
        if (!properties.hasSourceId()) {
            logger.warn("No catalog source id configured, not starting catalog sync");
            return;
        }

        // First run fires immediately
        scheduledSync = taskScheduler.scheduleAtFixedRate(this::tick, clock.instant(), properties.getInterval());
        logger.info("Catalog sync started for source {} every {}s",
                properties.getSourceId(), properties.getInterval().toSeconds());
    }

    @Override
    @PreDestroy
    public synchronized void stop() {
        ScheduledFuture<?> current = scheduledSync;
        if (current == null) {
            return;
        }
        current.cancel(false);
        scheduledSync = null;
        logger.info("Catalog sync stopped");
    }

    @Override
    public boolean isRunning() {
        return scheduledSync != null;
    }

    void tick() {
        if (syncing.get()) {
            logger.debug("Previous sync still in flight, skipping tick");
            return;
        }
        performSync();
    }

    @Override
    public SyncResult performSync() {
        if (!properties.hasSourceId()) {
            logger.warn("No catalog source id configured, sync not attempted");
            return SyncResult.failed(MISSING_SOURCE_ID);
        }
        if (!syncing.compareAndSet(false, true)) {
            logger.debug("Sync already in progress, rejecting request");
            return SyncResult.alreadyInProgress();
        }

        String sourceId = properties.getSourceId();
        SyncMetadata before = currentMetadata(sourceId);
        metadataRepository.save(before.syncing(clock.instant()));
        boolean lastAttemptFailed = consecutiveErrors.get() > 0 || before.status() == SyncStatus.ERROR;

        try {
            SyncOutcome outcome = syncCatalog.synchronize(lastAttemptFailed);

            if (outcome.skipped()) {
                consecutiveErrors.set(0);
                metadataRepository.save(before.unchanged(clock.instant()));
                return SyncResult.skipped(outcome.reason());
            }

            consecutiveErrors.set(0);
            metadataRepository.save(before.syncing(clock.instant())
                    .succeeded(clock.instant(), outcome.categoryCounts(), outcome.totalItems()));
            return SyncResult.completed(outcome);

        } catch (Exception e) {
            int errors = consecutiveErrors.incrementAndGet();
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            logger.error("Catalog sync failed for source {} ({} consecutive errors)", sourceId, errors, e);
            metadataRepository.save(before.failed(clock.instant(), errors, message));

            if (errors >= properties.getErrorThreshold()) {
                logger.error("Stopping catalog sync after {} consecutive errors", errors);
                stop();
            }
            return SyncResult.failed(message);

        } finally {
            syncing.set(false);
        }
    }

    @Override
    public SyncResult performManualSync() {
        logger.info("Manual catalog sync requested");
        return performSync();
    }

    @Override
    public SchedulerStatus getStatus() {
        return new SchedulerStatus(
                isRunning(),
                syncing.get(),
                consecutiveErrors.get(),
                new SchedulerStatus.Config(
                        properties.isEnabled(),
                        properties.getSourceId(),
                        properties.getInterval().toSeconds(),
                        properties.getMaxAttempts(),
                        properties.getRetryDelay().toSeconds(),
                        properties.getErrorThreshold()
                )
        );
    }

    @Override
    public synchronized void updateInterval(Duration interval) {
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("Sync interval must be positive, got: " + interval);
        }
        properties.setInterval(interval);
        logger.info("Catalog sync interval set to {}s", interval.toSeconds());

        if (isRunning()) {
            stop();
            start();
        }
    }

    private SyncMetadata currentMetadata(String sourceId) {
        return metadataRepository.find(sourceId).orElseGet(() -> SyncMetadata.initial(sourceId));
    }
}

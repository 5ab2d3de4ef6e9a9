package com.drinkjoy.catalog.application.health;

import com.drinkjoy.catalog.domain.model.SyncMetadata;
import com.drinkjoy.catalog.domain.model.SyncStatus;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Derives a 0-100 health score and operator alerts from a snapshot of the sync state.
 * Nothing here is stored; every call recomputes from scratch.
 */
@Component
public class SyncHealthEvaluator {

    private static final int HIGH_ERROR_COUNT = 3;
    private static final int CRITICAL_ERROR_COUNT = 5;
    private static final int MIN_CATEGORIES = 3;
    private static final Duration RECENT_SYNC = Duration.ofHours(2);
    private static final Duration STALE_SYNC = Duration.ofHours(24);

    private final Clock clock;

    public SyncHealthEvaluator(Clock clock) {
        this.clock = clock;
    }

    public HealthReport evaluate(HealthSnapshot snapshot) {
        Instant now = clock.instant();
        int score = Math.max(0, Math.min(100, score(snapshot, now)));
        return new HealthReport(score, HealthStatus.fromScore(score), snapshot.storeFresh(), alerts(snapshot, now));
    }

    int score(HealthSnapshot snapshot, Instant now) {
        int score = 0;

        if (snapshot.running()) score += 15;
        if (!snapshot.syncing()) score += 10;
        if (snapshot.consecutiveErrors() < HIGH_ERROR_COUNT) score += 5;

        if (snapshot.storeFresh()) score += 15;
        if (snapshot.stats().totalCount() > 0) score += 10;
        if (snapshot.stats().perCategoryCounts().size() >= MIN_CATEGORIES) score += 5;

        SyncMetadata metadata = snapshot.metadata();
        if (metadata != null) {
            if (metadata.status() == SyncStatus.SUCCESS) {
                score += 15;
            } else if (metadata.status() == SyncStatus.SYNCING) {
                score += 10;
            }

            if (metadata.lastSuccess() != null) {
                Duration sinceSuccess = Duration.between(metadata.lastSuccess(), now);
                if (sinceSuccess.compareTo(RECENT_SYNC) < 0) {
                    score += 10;
                } else if (sinceSuccess.compareTo(STALE_SYNC) < 0) {
                    score += 5;
                }
            }
        }

        if (snapshot.sourceIdConfigured()) score += 5;
        if (snapshot.apiKeyConfigured()) score += 10;

        return score;
    }

    List<Alert> alerts(HealthSnapshot snapshot, Instant now) {
        List<Alert> alerts = new ArrayList<>();

        if (!snapshot.running()) {
            alerts.add(new Alert(AlertLevel.ERROR, "Polling service is not running", now));
        }
        if (snapshot.consecutiveErrors() >= HIGH_ERROR_COUNT) {
            alerts.add(new Alert(AlertLevel.WARNING,
                    "High error rate: " + snapshot.consecutiveErrors() + " consecutive errors", now));
        }
        if (snapshot.consecutiveErrors() >= CRITICAL_ERROR_COUNT) {
            alerts.add(new Alert(AlertLevel.ERROR, "Polling service stopped due to too many errors", now));
        }

        if (!snapshot.storeFresh()) {
            alerts.add(new Alert(AlertLevel.WARNING, "Cache is stale or empty", now));
        }
        if (snapshot.stats().totalCount() == 0) {
            alerts.add(new Alert(AlertLevel.ERROR, "No drinks in cache", now));
        }

        SyncMetadata metadata = snapshot.metadata();
        if (metadata == null) {
            alerts.add(new Alert(AlertLevel.INFO, "No sync metadata found", now));
        } else {
            if (metadata.status() == SyncStatus.ERROR) {
                String detail = metadata.lastErrorMessage() != null ? metadata.lastErrorMessage() : "unknown error";
                alerts.add(new Alert(AlertLevel.ERROR, "Last sync failed: " + detail, now));
            }
            if (metadata.lastSuccess() != null
                    && Duration.between(metadata.lastSuccess(), now).compareTo(STALE_SYNC) > 0) {
                long hours = Duration.between(metadata.lastSuccess(), now).toHours();
                alerts.add(new Alert(AlertLevel.WARNING, "No successful sync in " + hours + " hours", now));
            }
        }

        if (!snapshot.sourceIdConfigured()) {
            alerts.add(new Alert(AlertLevel.WARNING, "Catalog source id is not configured", now));
        }
        if (!snapshot.apiKeyConfigured()) {
            alerts.add(new Alert(AlertLevel.ERROR, "Source API key is not configured", now));
        }

        return alerts;
    }
}

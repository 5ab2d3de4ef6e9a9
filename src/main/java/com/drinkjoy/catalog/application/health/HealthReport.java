package com.drinkjoy.catalog.application.health;

import java.util.List;

public record HealthReport(
        int score,
        HealthStatus status,
        boolean cacheHealthy,
        List<Alert> alerts
) {
    public HealthReport {
        alerts = List.copyOf(alerts);
    }
}

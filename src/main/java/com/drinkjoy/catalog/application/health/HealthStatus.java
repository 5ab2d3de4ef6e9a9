package com.drinkjoy.catalog.application.health;

import com.fasterxml.jackson.annotation.JsonValue;

public enum HealthStatus {
    HEALTHY,
    WARNING,
    CRITICAL;

    static HealthStatus fromScore(int score) {
        if (score >= 80) {
            return HEALTHY;
        }
        return score >= 60 ? WARNING : CRITICAL;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }
}

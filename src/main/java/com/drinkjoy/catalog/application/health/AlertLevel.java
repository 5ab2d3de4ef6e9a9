package com.drinkjoy.catalog.application.health;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AlertLevel {
    INFO,
    WARNING,
    ERROR;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }
}

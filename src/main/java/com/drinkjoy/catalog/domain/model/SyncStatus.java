package com.drinkjoy.catalog.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SyncStatus {

    IDLE,
    SYNCING,
    SUCCESS,
    ERROR;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }
}

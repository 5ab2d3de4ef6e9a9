package com.drinkjoy.catalog.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

public enum FlavorTag {

    SWEET,
    BITTER,
    SOUR,
    SAVORY,
    REFRESHING,
    FRUITY,
    SPICY,
    SMOKY,
    HERBAL,
    SMOOTH;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }

    public static Optional<FlavorTag> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim();
        return Arrays.stream(values())
                .filter(tag -> tag.value().equalsIgnoreCase(normalized))
                .findFirst();
    }
}

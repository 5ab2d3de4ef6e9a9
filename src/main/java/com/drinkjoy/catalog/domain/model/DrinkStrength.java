package com.drinkjoy.catalog.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

public enum DrinkStrength {

    LIGHT("light"),
    MEDIUM("medium"),
    STRONG("strong"),
    NON_ALCOHOLIC("non-alcoholic");

    private final String value;

    DrinkStrength(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public static Optional<DrinkStrength> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase();
        return Arrays.stream(values())
                .filter(strength -> strength.value.equals(normalized))
                .findFirst();
    }

    @JsonCreator
    public static DrinkStrength fromJson(String value) {
        return fromValue(value).orElse(LIGHT);
    }
}

package com.drinkjoy.catalog.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

public enum Occasion {

    CASUAL("casual"),
    PARTY("party"),
    ROMANTIC("romantic"),
    BUSINESS("business"),
    RELAXING("relaxing"),
    CELEBRATION("celebration"),
    SPORTS("sports"),
    EXPLORING("exploring"),
    NEWLY_21("newly21"),
    BIRTHDAY("birthday");

    private final String value;

    Occasion(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public static Optional<Occasion> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim();
        return Arrays.stream(values())
                .filter(occasion -> occasion.value.equalsIgnoreCase(normalized))
                .findFirst();
    }
}

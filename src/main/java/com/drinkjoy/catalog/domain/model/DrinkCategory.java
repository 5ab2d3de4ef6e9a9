package com.drinkjoy.catalog.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Closed set of catalog categories.
 * Each category is backed by one partition (tab) of the source spreadsheet.
 */
public enum DrinkCategory {

    BEER("beer", "Beer"),
    WINE("wine", "Wine"),
    COCKTAIL("cocktail", "Cocktail"),
    SPIRIT("spirit", "Spirit"),
    NON_ALCOHOLIC("non-alcoholic", "Non_Alcoholic");

    private final String value;
    private final String partition;

    DrinkCategory(String value, String partition) {
        this.value = value;
        this.partition = partition;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public String partition() {
        return partition;
    }

    public static Optional<DrinkCategory> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase();
        return Arrays.stream(values())
                .filter(category -> category.value.equals(normalized))
                .findFirst();
    }

    public static Optional<DrinkCategory> fromPartition(String partition) {
        if (partition == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(category -> category.partition.equalsIgnoreCase(partition.trim()))
                .findFirst();
    }

    @JsonCreator
    public static DrinkCategory fromJson(String value) {
        return fromValue(value)
                .orElseThrow(() -> new IllegalArgumentException("Unknown drink category: " + value));
    }
}

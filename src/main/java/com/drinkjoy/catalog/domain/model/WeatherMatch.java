package com.drinkjoy.catalog.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Temperature band (Celsius) and sky conditions a drink is recommended for.
 */
public record WeatherMatch(
        @JsonProperty("temp_min") double tempMin,
        @JsonProperty("temp_max") double tempMax,
        @JsonProperty("conditions") List<String> conditions,
        @JsonProperty("ideal_temp") double idealTemp
) {
    public static final WeatherMatch DEFAULT = new WeatherMatch(0, 40, List.of("clear"), 25);

    public WeatherMatch {
        conditions = conditions != null && !conditions.isEmpty() ? List.copyOf(conditions) : List.of("clear");
    }
}

package com.drinkjoy.catalog.infrastructure.adapter.mapper;

import com.drinkjoy.catalog.domain.model.CatalogItem;
import com.drinkjoy.catalog.domain.model.DrinkCategory;
import com.drinkjoy.catalog.domain.model.DrinkStrength;
import com.drinkjoy.catalog.domain.model.FlavorTag;
import com.drinkjoy.catalog.domain.model.Occasion;
import com.drinkjoy.catalog.domain.model.WeatherMatch;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

@Component
public class CatalogItemMapper {

    private static final Logger logger = LoggerFactory.getLogger(CatalogItemMapper.class);
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};
    // drink_catalog.id is VARCHAR(255)
    static final int MAX_ID_LENGTH = 255;

    private final ObjectMapper objectMapper;

    public CatalogItemMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Maps the data rows of one partition to catalog items
     * Rows without id or name are dropped
     */
    public List<CatalogItem> mapRows(List<String> headers, List<List<String>> rows, DrinkCategory category) {
        return rows.stream()
                .map(row -> mapRow(headers, row, category))
                .filter(Objects::nonNull)
                .toList();
    }

    /**
     * Maps a single row, keyed by the header row's column names
     */
    CatalogItem mapRow(List<String> headers, List<String> row, DrinkCategory category) {
        Map<String, String> cells = toCells(headers, row);
        String id = cells.getOrDefault("id", "").trim();
        String name = cells.getOrDefault("name", "").trim();

        if (id.isEmpty() || name.isEmpty()) {
            logger.warn("Skipping {} row with missing required fields: id='{}', name='{}'",
                    category.partition(), id, name);
            return null;
        }
        if (id.length() > MAX_ID_LENGTH) {
            logger.warn("Skipping {} row with id longer than {} characters: '{}...'",
                    category.partition(), MAX_ID_LENGTH, id.substring(0, 32));
            return null;
        }

        try {
            return new CatalogItem(
                    id,
                    name,
                    category,
                    cells.getOrDefault("description", ""),
                    parseList(cells.get("ingredients")),
                    parseAbv(cells.get("abv")),
                    DrinkStrength.fromValue(cells.get("strength")).orElse(DrinkStrength.LIGHT),
                    parseWeatherMatch(cells),
                    parseTags(cells.get("flavor_profile"), FlavorTag::fromValue),
                    parseTags(cells.get("occasions"), Occasion::fromValue),
                    parseList(cells.get("serving_suggestions")),
                    cells.getOrDefault("image_url", ""),
                    textOr(cells.get("price"), "$0"),
                    textOr(cells.get("price_16oz"), null),
                    textOr(cells.get("price_24oz"), null),
                    textOr(cells.get("glass_type"), null),
                    textOr(cells.get("preparation"), null),
                    isTrue(cells.get("happy_hour")),
                    textOr(cells.get("happy_hour_price"), null),
                    textOr(cells.get("happy_hour_times"), null),
                    isTrue(cells.get("featured")),
                    isTrue(cells.get("funForTwentyOne")),
                    isTrue(cells.get("goodForBDay"))
            );
        } catch (Exception e) {
            logger.warn("Failed to map {} row for item {}: {}", category.partition(), id, e.getMessage());
            return null;
        }
    }

    private Map<String, String> toCells(List<String> headers, List<String> row) {
        Map<String, String> cells = new HashMap<>();
        for (int i = 0; i < headers.size(); i++) {
            String header = headers.get(i);
            if (header == null || header.isBlank()) {
                continue;
            }
            String value = i < row.size() && row.get(i) != null ? row.get(i) : "";
            cells.putIfAbsent(header.trim(), value);
        }
        return cells;
    }

    /**
     * Accepts a JSON array or a comma/semicolon separated string
     */
    List<String> parseList(String raw) {
        if (raw == null || raw.isBlank()) {
            return List.of();
        }
        String trimmed = raw.trim();
        if (trimmed.startsWith("[")) {
            try {
                return objectMapper.readValue(trimmed, STRING_LIST).stream()
                        .filter(Objects::nonNull)
                        .map(String::trim)
                        .filter(s -> !s.isEmpty())
                        .toList();
            } catch (JsonProcessingException e) {
                logger.debug("Value is not a JSON array, splitting instead: {}", trimmed);
            }
        }
        return Arrays.stream(trimmed.split("[,;]"))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    /**
     * Reads a {@code weather_match} JSON object, or the split {@code weather_*} columns.
     * Missing or unreadable values take the defaults of {@link WeatherMatch#DEFAULT}.
     */
    WeatherMatch parseWeatherMatch(Map<String, String> cells) {
        WeatherMatch fallback = WeatherMatch.DEFAULT;
        String raw = cells.get("weather_match");
        if (raw != null && !raw.isBlank()) {
            try {
                JsonNode node = objectMapper.readTree(raw.trim());
                if (node.isObject()) {
                    return new WeatherMatch(
                            numberOr(node.get("temp_min"), fallback.tempMin()),
                            numberOr(node.get("temp_max"), fallback.tempMax()),
                            conditionsOf(node.get("conditions")),
                            numberOr(node.get("ideal_temp"), fallback.idealTemp()));
                }
            } catch (JsonProcessingException e) {
                logger.debug("Unreadable weather_match value, using defaults: {}", raw);
            }
            return fallback;
        }
        return new WeatherMatch(
                parseDouble(cells.get("weather_temp_min"), fallback.tempMin()),
                parseDouble(cells.get("weather_temp_max"), fallback.tempMax()),
                parseList(cells.get("weather_conditions")),
                parseDouble(cells.get("weather_ideal_temp"), fallback.idealTemp()));
    }

    private List<String> conditionsOf(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        return parseList(node.isArray() ? node.toString() : node.asText());
    }

    private double numberOr(JsonNode node, double fallback) {
        if (node == null || node.isNull()) {
            return fallback;
        }
        return node.isNumber() ? node.asDouble() : parseDouble(node.asText(), fallback);
    }

    private <T> Set<T> parseTags(String raw, Function<String, Optional<T>> resolver) {
        Set<T> tags = new LinkedHashSet<>();
        for (String value : parseList(raw)) {
            resolver.apply(value).ifPresent(tags::add);
        }
        return tags;
    }

    private double parseAbv(String raw) {
        return parseDouble(raw == null ? null : raw.replace("%", ""), 0.0);
    }

    private double parseDouble(String raw, double fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            double value = Double.parseDouble(raw.trim());
            return Double.isFinite(value) ? value : fallback;
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    private boolean isTrue(String raw) {
        return raw != null && "true".equalsIgnoreCase(raw.trim());
    }

    private String textOr(String raw, String fallback) {
        return raw == null || raw.isBlank() ? fallback : raw.trim();
    }
}

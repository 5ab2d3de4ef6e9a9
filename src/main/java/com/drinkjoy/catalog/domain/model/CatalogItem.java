package com.drinkjoy.catalog.domain.model;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A single drink on the catalog, as read from the source spreadsheet.
 * Identity is {@code id}; two items with the same id never coexist in one sync.
 */
public record CatalogItem(
        String id,
        String name,
        DrinkCategory category,
        String description,
        List<String> ingredients,
        double abv,
        DrinkStrength strength,
        WeatherMatch weatherMatch,
        Set<FlavorTag> flavorProfile,
        Set<Occasion> occasions,
        List<String> servingSuggestions,
        String imageUrl,
        String price,
        String price16oz,
        String price24oz,
        String glassType,
        String preparation,
        boolean happyHour,
        String happyHourPrice,
        String happyHourTimes,
        boolean featured,
        boolean funForTwentyOne,
        boolean goodForBirthday
) {
    public CatalogItem {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(category, "category must not be null");
        description = description != null ? description : "";
        ingredients = ingredients != null ? List.copyOf(ingredients) : List.of();
        strength = strength != null ? strength : DrinkStrength.LIGHT;
        weatherMatch = weatherMatch != null ? weatherMatch : WeatherMatch.DEFAULT;
        flavorProfile = flavorProfile != null ? Set.copyOf(flavorProfile) : Set.of();
        occasions = occasions != null ? Set.copyOf(occasions) : Set.of();
        servingSuggestions = servingSuggestions != null ? List.copyOf(servingSuggestions) : List.of();
        imageUrl = imageUrl != null ? imageUrl : "";
    }

    /**
     * Minimal item with defaults for every optional field
     */
    public static CatalogItem of(String id, String name, DrinkCategory category) {
        return new CatalogItem(id, name, category, "", List.of(), 0.0, DrinkStrength.LIGHT, WeatherMatch.DEFAULT,
                Set.of(), Set.of(), List.of(), "", "$0", null, null, null, null,
                false, null, null, false, false, false);
    }
}

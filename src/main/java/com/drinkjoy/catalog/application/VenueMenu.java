package com.drinkjoy.catalog.application;

import com.drinkjoy.catalog.domain.model.CatalogItem;

import java.util.List;

public record VenueMenu(
        String venueId,
        List<CatalogItem> items,
        MenuSource source
) {
    public VenueMenu {
        items = items != null ? List.copyOf(items) : List.of();
    }

    public static VenueMenu empty(String venueId) {
        return new VenueMenu(venueId, List.of(), MenuSource.NONE);
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }
}

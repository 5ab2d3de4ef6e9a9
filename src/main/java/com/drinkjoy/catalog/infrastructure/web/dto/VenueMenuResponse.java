package com.drinkjoy.catalog.infrastructure.web.dto;

import com.drinkjoy.catalog.application.MenuSource;
import com.drinkjoy.catalog.application.VenueMenu;
import com.drinkjoy.catalog.domain.model.CatalogItem;

import java.util.List;

public record VenueMenuResponse(
        String venueId,
        MenuSource source,
        int count,
        List<CatalogItem> items
) {
    public static VenueMenuResponse fromMenu(VenueMenu menu) {
        return new VenueMenuResponse(menu.venueId(), menu.source(), menu.items().size(), menu.items());
    }
}

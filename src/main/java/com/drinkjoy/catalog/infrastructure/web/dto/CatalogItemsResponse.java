package com.drinkjoy.catalog.infrastructure.web.dto;

import com.drinkjoy.catalog.domain.model.CatalogItem;

import java.util.List;

public record CatalogItemsResponse(
        CatalogData data
) {
    public static CatalogItemsResponse fromItems(List<CatalogItem> items) {
        return new CatalogItemsResponse(new CatalogData(items, items.size()));
    }

    public static CatalogItemsResponse empty() {
        return new CatalogItemsResponse(new CatalogData(List.of(), 0));
    }

    public record CatalogData(
            List<CatalogItem> items,
            int count
    ) {}
}

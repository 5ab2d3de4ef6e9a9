package com.drinkjoy.catalog.application;

import com.drinkjoy.catalog.domain.model.CatalogItem;
import com.drinkjoy.catalog.domain.model.DrinkCategory;

import java.util.List;
import java.util.Optional;

/**
 * Read access to the shared catalog.
 * Implementations never throw; a failed lookup yields an empty result.
 */
public interface FindCatalogItems {

    List<CatalogItem> findAll();

    List<CatalogItem> findByCategory(DrinkCategory category);

    Optional<CatalogItem> findById(String id);
}

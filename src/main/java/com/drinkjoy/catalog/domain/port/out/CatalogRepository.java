package com.drinkjoy.catalog.domain.port.out;

import com.drinkjoy.catalog.domain.model.CatalogItem;
import com.drinkjoy.catalog.domain.model.CatalogStats;
import com.drinkjoy.catalog.domain.model.DrinkCategory;

import java.util.List;
import java.util.Optional;

/**
 * Repository port for the persisted catalog mirror
 * Reads never throw: failures surface as empty results
 */
public interface CatalogRepository {

    List<CatalogItem> getAll();

    List<CatalogItem> getByCategory(DrinkCategory category);

    Optional<CatalogItem> getById(String id);

    /**
     * Replace the whole catalog: delete everything, then insert in batches.
     * Not atomic, a concurrent reader may observe an empty or partial catalog.
     *
     * @return false if any statement failed
     */
    boolean replaceAll(List<CatalogItem> items);

    /**
     * Replace only the items of one category, leaving the others untouched
     */
    boolean replaceCategory(DrinkCategory category, List<CatalogItem> items);

    CatalogStats getStats();

    /**
     * @return true if the catalog is non-empty and its newest row is at most maxAgeMinutes old
     */
    boolean isHealthy(long maxAgeMinutes);

    boolean clear();
}

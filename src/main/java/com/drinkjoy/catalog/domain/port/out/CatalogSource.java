package com.drinkjoy.catalog.domain.port.out;

import com.drinkjoy.catalog.domain.model.CatalogItem;

import java.util.List;

/**
 * Port for reading the catalog from the external tabular source.
 * Domain doesn't care about HTTP, spreadsheets or JSON.
 */
public interface CatalogSource {

    /**
     * Fetch every category partition of the configured catalog source.
     *
     * @return the union of all partitions that could be read, never empty
     * @throws com.drinkjoy.catalog.domain.exception.SourceUnavailableException if no partition produced data
     */
    List<CatalogItem> fetchAll();

    /**
     * Same as {@link #fetchAll()} against a specific source, e.g. a venue's own menu sheet.
     */
    List<CatalogItem> fetchAll(String sourceLocator);
}

package com.drinkjoy.catalog.infrastructure.adapter.source;

import com.drinkjoy.catalog.domain.exception.PartitionFetchException;
import com.drinkjoy.catalog.domain.exception.SourceUnavailableException;
import com.drinkjoy.catalog.domain.model.CatalogItem;
import com.drinkjoy.catalog.domain.model.DrinkCategory;
import com.drinkjoy.catalog.domain.port.out.CatalogSource;
import com.drinkjoy.catalog.infrastructure.adapter.mapper.CatalogItemMapper;
import com.drinkjoy.catalog.infrastructure.config.SourceProperties;
import com.drinkjoy.catalog.infrastructure.config.SyncProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import retrofit2.Response;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads the catalog from a spreadsheet, one HTTP request per category tab.
 * A failing tab is logged and skipped so the rest of the catalog still syncs.
 */
@Component
public class SheetsCatalogSource implements CatalogSource {

    private static final Logger logger = LoggerFactory.getLogger(SheetsCatalogSource.class);

    private final SheetsValuesApi valuesApi;
    private final CatalogItemMapper itemMapper;
    private final SourceProperties sourceProperties;
    private final SyncProperties syncProperties;

    public SheetsCatalogSource(SheetsValuesApi valuesApi,
                               CatalogItemMapper itemMapper,
                               SourceProperties sourceProperties,
                               SyncProperties syncProperties) {
        this.valuesApi = valuesApi;
        this.itemMapper = itemMapper;
        this.sourceProperties = sourceProperties;
        this.syncProperties = syncProperties;
    }

    @Override
    public List<CatalogItem> fetchAll() {
        if (!syncProperties.hasSourceId()) {
            throw new SourceUnavailableException("No catalog source id configured");
        }
        return fetchAll(syncProperties.getSourceId());
    }

    @Override
    public List<CatalogItem> fetchAll(String sourceLocator) {
        if (sourceLocator == null || sourceLocator.isBlank()) {
            throw new SourceUnavailableException("Source locator must not be blank");
        }

        Map<String, CatalogItem> itemsById = new LinkedHashMap<>();
        for (String partition : sourceProperties.getPartitions()) {
            Optional<DrinkCategory> category = DrinkCategory.fromPartition(partition);
            if (category.isEmpty()) {
                logger.warn("Ignoring unknown partition '{}' for source {}", partition, sourceLocator);
                continue;
            }

            try {
                List<CatalogItem> items = fetchPartition(sourceLocator, partition, category.get());
                logger.debug("Fetched {} items from partition {} of source {}", items.size(), partition, sourceLocator);
                for (CatalogItem item : items) {
                    CatalogItem existing = itemsById.putIfAbsent(item.id(), item);
                    if (existing != null) {
                        logger.warn("Duplicate item id {} in partition {} of source {}, keeping first occurrence ({})",
                                item.id(), partition, sourceLocator, existing.category().value());
                    }
                }
            } catch (PartitionFetchException e) {
                logger.warn("Skipping partition {} of source {}: {}", e.getPartition(), sourceLocator, e.getMessage());
            }
        }

        if (itemsById.isEmpty()) {
            throw new SourceUnavailableException("no data");
        }

        logger.info("Fetched {} catalog items from source {}", itemsById.size(), sourceLocator);
        return new ArrayList<>(itemsById.values());
    }

    private List<CatalogItem> fetchPartition(String sourceLocator, String partition, DrinkCategory category) {
        String range = partition + "!" + sourceProperties.getRowRange();
        Response<ValueRangeResponse> response;
        try {
            response = valuesApi.getValues(sourceLocator, range, sourceProperties.getApiKey()).execute();
        } catch (IOException | RuntimeException e) {
            throw new PartitionFetchException(partition, "request failed: " + e.getMessage(), e);
        }

        if (!response.isSuccessful()) {
            throw new PartitionFetchException(partition, "HTTP " + response.code());
        }

        ValueRangeResponse body = response.body();
        if (body == null || !body.hasRows()) {
            logger.debug("Partition {} of source {} has no data rows", partition, sourceLocator);
            return List.of();
        }

        List<String> headers = body.values().get(0);
        List<List<String>> rows = body.values().subList(1, body.values().size());
        return itemMapper.mapRows(headers, rows, category);
    }
}

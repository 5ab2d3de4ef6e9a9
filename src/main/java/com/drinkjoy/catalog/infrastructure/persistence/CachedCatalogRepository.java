package com.drinkjoy.catalog.infrastructure.persistence;

import com.drinkjoy.catalog.domain.model.CatalogItem;
import com.drinkjoy.catalog.domain.model.CatalogStats;
import com.drinkjoy.catalog.domain.model.DrinkCategory;
import com.drinkjoy.catalog.domain.port.out.CatalogRepository;
import com.drinkjoy.catalog.infrastructure.cache.ExpiringCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Cached implementation of CatalogRepository using decorator pattern
 * Transparently adds short-lived memoization to the JDBC mirror
 */
@Repository
@Primary
public class CachedCatalogRepository implements CatalogRepository {

    private static final Logger logger = LoggerFactory.getLogger(CachedCatalogRepository.class);

    static final String ALL_KEY = "drinks:all";
    static final String CATEGORY_KEY_PREFIX = "drinks:category:";
    static final String ID_KEY_PREFIX = "drinks:id:";

    private final CatalogRepository databaseRepository;
    private final ExpiringCache<String, List<CatalogItem>> cache;

    public CachedCatalogRepository(
            @Qualifier("jdbcCatalogRepository") CatalogRepository databaseRepository,
            ExpiringCache<String, List<CatalogItem>> cache) {
        this.databaseRepository = databaseRepository;
        this.cache = cache;
    }

    @Override
    public List<CatalogItem> getAll() {
        return cached(ALL_KEY, databaseRepository::getAll);
    }

    @Override
    public List<CatalogItem> getByCategory(DrinkCategory category) {
        return cached(CATEGORY_KEY_PREFIX + category.value(), () -> databaseRepository.getByCategory(category));
    }

    @Override
    public Optional<CatalogItem> getById(String id) {
        return cached(ID_KEY_PREFIX + id, () -> databaseRepository.getById(id).map(List::of).orElse(List.of()))
                .stream()
                .findFirst();
    }

    @Override
    public boolean replaceAll(List<CatalogItem> items) {
        invalidate();
        boolean replaced = databaseRepository.replaceAll(items);
        // Readers may have repopulated from the half-written table
        invalidate();
        return replaced;
    }

    @Override
    public boolean replaceCategory(DrinkCategory category, List<CatalogItem> items) {
        invalidate();
        boolean replaced = databaseRepository.replaceCategory(category, items);
        invalidate();
        return replaced;
    }

    @Override
    public CatalogStats getStats() {
        return databaseRepository.getStats();
    }

    @Override
    public boolean isHealthy(long maxAgeMinutes) {
        return databaseRepository.isHealthy(maxAgeMinutes);
    }

    @Override
    public boolean clear() {
        invalidate();
        return databaseRepository.clear();
    }

    private List<CatalogItem> cached(String key, Supplier<List<CatalogItem>> loader) {
        try {
            Optional<List<CatalogItem>> hit = cache.get(key);
            if (hit.isPresent()) {
                logger.debug("Cache hit for {}: {} items", key, hit.get().size());
                return hit.get();
            }

            logger.debug("Cache miss for {} - fetching from database", key);
            List<CatalogItem> items = loader.get();
            if (!items.isEmpty()) {
                cache.set(key, items);
            }
            return items;

        } catch (Exception e) {
            logger.error("Error in cached repository for {}, falling back to database", key, e);
            return safeDatabaseFallback(loader);
        }
    }

    private void invalidate() {
        try {
            cache.clear();
            logger.debug("Catalog cache invalidated");
        } catch (Exception e) {
            logger.warn("Cache invalidation failed, proceeding with database write: {}", e.getMessage());
        }
    }

    private List<CatalogItem> safeDatabaseFallback(Supplier<List<CatalogItem>> loader) {
        try {
            return loader.get();
        } catch (Exception dbError) {
            logger.error("Database fallback also failed", dbError);
            return List.of();
        }
    }
}

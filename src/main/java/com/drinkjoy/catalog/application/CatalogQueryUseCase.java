package com.drinkjoy.catalog.application;

import com.drinkjoy.catalog.domain.model.CatalogItem;
import com.drinkjoy.catalog.domain.model.DrinkCategory;
import com.drinkjoy.catalog.domain.port.out.CatalogRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

@Service
public class CatalogQueryUseCase implements FindCatalogItems {

    private static final Logger logger = LoggerFactory.getLogger(CatalogQueryUseCase.class);

    private final CatalogRepository catalogRepository;

    public CatalogQueryUseCase(CatalogRepository catalogRepository) {
        this.catalogRepository = catalogRepository;
    }

    @Override
    public List<CatalogItem> findAll() {
        try {
            List<CatalogItem> items = catalogRepository.getAll();
            logger.debug("Found {} catalog items", items.size());
            return items;
        } catch (Exception e) {
            logger.error("Error reading catalog", e);
            return List.of();
        }
    }

    @Override
    public List<CatalogItem> findByCategory(DrinkCategory category) {
        try {
            List<CatalogItem> items = catalogRepository.getByCategory(category);
            logger.debug("Found {} items in category {}", items.size(), category.value());
            return items;
        } catch (Exception e) {
            logger.error("Error reading category {}", category.value(), e);
            return List.of();
        }
    }

    @Override
    public Optional<CatalogItem> findById(String id) {
        if (id == null || id.isBlank()) {
            return Optional.empty();
        }
        try {
            return catalogRepository.getById(id);
        } catch (Exception e) {
            logger.error("Error reading item {}", id, e);
            return Optional.empty();
        }
    }
}

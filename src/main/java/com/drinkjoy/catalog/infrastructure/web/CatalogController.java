package com.drinkjoy.catalog.infrastructure.web;

import com.drinkjoy.catalog.application.FindCatalogItems;
import com.drinkjoy.catalog.application.FindVenueMenu;
import com.drinkjoy.catalog.domain.model.CatalogItem;
import com.drinkjoy.catalog.domain.model.DrinkCategory;
import com.drinkjoy.catalog.infrastructure.web.dto.CatalogItemsResponse;
import com.drinkjoy.catalog.infrastructure.web.dto.VenueMenuResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Optional;

@RestController
public class CatalogController {

    private static final Logger logger = LoggerFactory.getLogger(CatalogController.class);

    private final FindCatalogItems findCatalogItems;
    private final FindVenueMenu findVenueMenu;

    public CatalogController(FindCatalogItems findCatalogItems, FindVenueMenu findVenueMenu) {
        this.findCatalogItems = findCatalogItems;
        this.findVenueMenu = findVenueMenu;
    }

    @GetMapping("/catalog/items")
    public ResponseEntity<CatalogItemsResponse> listItems(
            @RequestParam(value = "category", required = false) String category) {

        if (category == null || category.isBlank()) {
            List<CatalogItem> items = findCatalogItems.findAll();
            logger.debug("Returning {} catalog items", items.size());
            return ResponseEntity.ok(CatalogItemsResponse.fromItems(items));
        }

        Optional<DrinkCategory> drinkCategory = DrinkCategory.fromValue(category);
        if (drinkCategory.isEmpty()) {
            logger.warn("Unknown category requested: {}", category);
            return ResponseEntity.badRequest().body(CatalogItemsResponse.empty());
        }

        return ResponseEntity.ok(CatalogItemsResponse.fromItems(findCatalogItems.findByCategory(drinkCategory.get())));
    }

    @GetMapping("/catalog/items/{id}")
    public ResponseEntity<CatalogItem> getItem(@PathVariable("id") String id) {
        return findCatalogItems.findById(id)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/venues/{venueId}/menu")
    public ResponseEntity<VenueMenuResponse> venueMenu(@PathVariable("venueId") String venueId) {
        var menu = findVenueMenu.execute(venueId);
        logger.debug("Serving {} items for venue {} from {}", menu.items().size(), venueId, menu.source());
        return ResponseEntity.ok(VenueMenuResponse.fromMenu(menu));
    }
}

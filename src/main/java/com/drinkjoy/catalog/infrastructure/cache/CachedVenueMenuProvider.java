package com.drinkjoy.catalog.infrastructure.cache;

import com.drinkjoy.catalog.application.FindVenueMenu;
import com.drinkjoy.catalog.application.MenuSource;
import com.drinkjoy.catalog.application.VenueMenu;
import com.drinkjoy.catalog.domain.model.CatalogItem;
import com.drinkjoy.catalog.domain.model.Venue;
import com.drinkjoy.catalog.domain.port.out.CatalogRepository;
import com.drinkjoy.catalog.domain.port.out.CatalogSource;
import com.drinkjoy.catalog.domain.port.out.VenueRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Serves venue menus from the bounded menu cache, falling through to the venue's own
 * source and then to the shared persisted catalog
 */
@Service
public class CachedVenueMenuProvider implements FindVenueMenu {

    private static final Logger logger = LoggerFactory.getLogger(CachedVenueMenuProvider.class);

    private final VenueRepository venueRepository;
    private final VenueMenuCache menuCache;
    private final CatalogSource catalogSource;
    private final CatalogRepository catalogRepository;

    public CachedVenueMenuProvider(VenueRepository venueRepository,
                                   VenueMenuCache menuCache,
                                   CatalogSource catalogSource,
                                   CatalogRepository catalogRepository) {
        this.venueRepository = venueRepository;
        this.menuCache = menuCache;
        this.catalogSource = catalogSource;
        this.catalogRepository = catalogRepository;
    }

    @Override
    public VenueMenu execute(String venueId) {
        Optional<Venue> venue = venueRepository.findById(venueId);
        if (venue.isEmpty() || !venue.get().active()) {
            logger.debug("Venue {} not found or inactive", venueId);
            return VenueMenu.empty(venueId);
        }

        String locator = venue.get().sourceLocator();
        if (locator == null || locator.isBlank()) {
            logger.debug("Venue {} has no menu source, using shared catalog", venueId);
            return fromCatalog(venueId);
        }

        Optional<List<CatalogItem>> cached = menuCache.getMenu(venueId, locator);
        if (cached.isPresent()) {
            logger.debug("Menu cache hit for venue {}: {} items", venueId, cached.get().size());
            return new VenueMenu(venueId, cached.get(), MenuSource.CACHE);
        }

        try {
            List<CatalogItem> items = catalogSource.fetchAll(locator);
            menuCache.setMenu(venueId, locator, items);
            logger.info("Fetched menu for venue {} from source {}: {} items", venueId, locator, items.size());
            return new VenueMenu(venueId, items, MenuSource.SOURCE);
        } catch (Exception e) {
            logger.warn("Menu source {} unavailable for venue {}, falling back to shared catalog: {}",
                    locator, venueId, e.getMessage());
            return fromCatalog(venueId);
        }
    }

    private VenueMenu fromCatalog(String venueId) {
        try {
            List<CatalogItem> items = catalogRepository.getAll();
            return items.isEmpty() ? VenueMenu.empty(venueId) : new VenueMenu(venueId, items, MenuSource.CATALOG);
        } catch (Exception e) {
            logger.error("Shared catalog unavailable for venue {}", venueId, e);
            return VenueMenu.empty(venueId);
        }
    }
}

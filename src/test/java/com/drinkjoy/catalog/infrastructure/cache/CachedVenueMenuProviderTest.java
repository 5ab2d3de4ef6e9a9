package com.drinkjoy.catalog.infrastructure.cache;

import com.drinkjoy.catalog.application.MenuSource;
import com.drinkjoy.catalog.application.VenueMenu;
import com.drinkjoy.catalog.domain.exception.SourceUnavailableException;
import com.drinkjoy.catalog.domain.model.CatalogItem;
import com.drinkjoy.catalog.domain.model.Coordinates;
import com.drinkjoy.catalog.domain.model.DrinkCategory;
import com.drinkjoy.catalog.domain.model.Venue;
import com.drinkjoy.catalog.domain.port.out.CatalogRepository;
import com.drinkjoy.catalog.domain.port.out.CatalogSource;
import com.drinkjoy.catalog.domain.port.out.VenueRepository;
import com.drinkjoy.catalog.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CachedVenueMenuProviderTest {

    private static final Coordinates MADRID = new Coordinates(40.4168, -3.7038);
    private static final List<CatalogItem> VENUE_MENU = List.of(CatalogItem.of("house-ipa", "House IPA", DrinkCategory.BEER));
    private static final List<CatalogItem> SHARED_CATALOG = List.of(CatalogItem.of("mojito", "Mojito", DrinkCategory.COCKTAIL));

    @Mock
    private VenueRepository venueRepository;

    @Mock
    private CatalogSource catalogSource;

    @Mock
    private CatalogRepository catalogRepository;

    private MutableClock clock;
    private VenueMenuCache menuCache;
    private CachedVenueMenuProvider provider;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-06-01T21:00:00Z"));
        menuCache = new VenueMenuCache(clock, 50, Duration.ofMinutes(5));
        provider = new CachedVenueMenuProvider(venueRepository, menuCache, catalogSource, catalogRepository);
    }

    @Test
    void shouldFetchFromSourceThenServeFromCache() {
        // Given
        when(venueRepository.findById("bar-1")).thenReturn(Optional.of(venue("bar-1", "sheet-1", true)));
        when(catalogSource.fetchAll("sheet-1")).thenReturn(VENUE_MENU);

        // When
        VenueMenu first = provider.execute("bar-1");
        VenueMenu second = provider.execute("bar-1");

        // Then
        assertThat(first.source()).isEqualTo(MenuSource.SOURCE);
        assertThat(second.source()).isEqualTo(MenuSource.CACHE);
        assertThat(second.items()).isEqualTo(VENUE_MENU);
        verify(catalogSource, times(1)).fetchAll("sheet-1");
    }

    @Test
    void shouldRefetchWhenVenueIsRepointed() {
        // Given
        when(venueRepository.findById("bar-1"))
                .thenReturn(Optional.of(venue("bar-1", "sheet-old", true)))
                .thenReturn(Optional.of(venue("bar-1", "sheet-new", true)));
        when(catalogSource.fetchAll("sheet-old")).thenReturn(VENUE_MENU);
        when(catalogSource.fetchAll("sheet-new")).thenReturn(SHARED_CATALOG);

        // When
        provider.execute("bar-1");
        VenueMenu repointed = provider.execute("bar-1");

        // Then
        assertThat(repointed.source()).isEqualTo(MenuSource.SOURCE);
        assertThat(repointed.items()).isEqualTo(SHARED_CATALOG);
    }

    @Test
    void shouldFallBackToSharedCatalogWhenSourceFails() {
        // Given
        when(venueRepository.findById("bar-1")).thenReturn(Optional.of(venue("bar-1", "sheet-1", true)));
        when(catalogSource.fetchAll("sheet-1")).thenThrow(new SourceUnavailableException("no data"));
        when(catalogRepository.getAll()).thenReturn(SHARED_CATALOG);

        // When
        VenueMenu menu = provider.execute("bar-1");

        // Then
        assertThat(menu.source()).isEqualTo(MenuSource.CATALOG);
        assertThat(menu.items()).isEqualTo(SHARED_CATALOG);
        assertThat(menuCache.stats().totalCachedVenues()).isZero();
    }

    @Test
    void shouldReturnEmptyWhenEveryTierIsEmpty() {
        // Given
        when(venueRepository.findById("bar-1")).thenReturn(Optional.of(venue("bar-1", "sheet-1", true)));
        when(catalogSource.fetchAll("sheet-1")).thenThrow(new SourceUnavailableException("no data"));
        when(catalogRepository.getAll()).thenReturn(List.of());

        // When
        VenueMenu menu = provider.execute("bar-1");

        // Then
        assertThat(menu.source()).isEqualTo(MenuSource.NONE);
        assertThat(menu.isEmpty()).isTrue();
    }

    @Test
    void shouldReturnEmptyForUnknownOrInactiveVenue() {
        // Given
        when(venueRepository.findById("ghost")).thenReturn(Optional.empty());
        when(venueRepository.findById("closed")).thenReturn(Optional.of(venue("closed", "sheet-x", false)));

        // When & Then
        assertThat(provider.execute("ghost").source()).isEqualTo(MenuSource.NONE);
        assertThat(provider.execute("closed").source()).isEqualTo(MenuSource.NONE);
        verifyNoInteractions(catalogSource, catalogRepository);
    }

    private static Venue venue(String id, String locator, boolean active) {
        return new Venue(id, "Venue " + id, MADRID, locator, active);
    }
}

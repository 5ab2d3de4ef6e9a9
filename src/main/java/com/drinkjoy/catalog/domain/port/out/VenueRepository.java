package com.drinkjoy.catalog.domain.port.out;

import com.drinkjoy.catalog.domain.model.Venue;

import java.util.Optional;

/**
 * Read-only view of the venues maintained by the administrative feed
 */
public interface VenueRepository {

    Optional<Venue> findById(String venueId);
}

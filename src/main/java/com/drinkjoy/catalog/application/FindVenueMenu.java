package com.drinkjoy.catalog.application;

/**
 * Resolves the menu a venue currently serves
 */
public interface FindVenueMenu {

    /**
     * @return the venue's menu with the tier it was served from; {@link MenuSource#NONE}
     * when the venue is unknown or inactive or no tier has data
     */
    VenueMenu execute(String venueId);
}

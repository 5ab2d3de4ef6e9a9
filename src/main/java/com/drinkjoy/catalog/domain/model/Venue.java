package com.drinkjoy.catalog.domain.model;

/**
 * A bar serving a menu. {@code sourceLocator} names the spreadsheet that supplies
 * its menu and may be repointed by the administrative feed at any time.
 */
public record Venue(
        String id,
        String name,
        Coordinates coordinates,
        String sourceLocator,
        boolean active
) {}

package com.drinkjoy.catalog.application;

public enum MenuSource {
    CACHE,
    SOURCE,
    CATALOG,
    NONE
}

package com.drinkjoy.catalog.domain.exception;

/**
 * Base type for failures while synchronizing the catalog with its source
 */
public class CatalogSyncException extends RuntimeException {

    public CatalogSyncException(String message) {
        super(message);
    }

    public CatalogSyncException(String message, Throwable cause) {
        super(message, cause);
    }
}

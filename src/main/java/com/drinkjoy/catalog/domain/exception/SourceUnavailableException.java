package com.drinkjoy.catalog.domain.exception;

/**
 * The external source could not be reached or returned nothing usable.
 * Retried by the scheduler, then recorded as a sync error.
 */
public class SourceUnavailableException extends CatalogSyncException {

    public SourceUnavailableException(String message) {
        super(message);
    }

    public SourceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}

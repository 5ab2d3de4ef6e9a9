package com.drinkjoy.catalog.domain.exception;

/**
 * Writing the fetched catalog to the store failed; the previous data keeps being served.
 */
public class PersistenceFailureException extends CatalogSyncException {

    public PersistenceFailureException(String message) {
        super(message);
    }

    public PersistenceFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}

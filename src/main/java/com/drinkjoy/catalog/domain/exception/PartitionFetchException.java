package com.drinkjoy.catalog.domain.exception;

/**
 * One category partition could not be read. Never escapes the fetch adapter.
 */
public class PartitionFetchException extends CatalogSyncException {

    private final String partition;

    public PartitionFetchException(String partition, String message) {
        super(message);
        this.partition = partition;
    }

    public PartitionFetchException(String partition, String message, Throwable cause) {
        super(message, cause);
        this.partition = partition;
    }

    public String getPartition() {
        return partition;
    }
}

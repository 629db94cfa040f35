package com.eventquery.infrastructure.store;

/**
 * Failure reading or writing the columnar store or the aggregate catalog.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}

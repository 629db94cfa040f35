package com.eventquery.infrastructure.store;

/**
 * The store does not hold what its metadata promised. Always fatal for the query:
 * answering from the remaining data would silently under-report aggregates.
 */
public abstract class StoreIntegrityException extends StoreException {

    protected StoreIntegrityException(String message) {
        super(message);
    }

    protected StoreIntegrityException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.eventquery.domain.exception;

/**
 * The query is malformed or asks for something the engine does not support.
 * Raised before any partition or cache is touched.
 */
public class InvalidQueryException extends RuntimeException {

    public InvalidQueryException(String message) {
        super(message);
    }

    public InvalidQueryException(String message, Throwable cause) {
        super(message, cause);
    }
}

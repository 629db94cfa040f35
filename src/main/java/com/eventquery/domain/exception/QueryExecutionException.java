package com.eventquery.domain.exception;

/**
 * Execution of a planned query was aborted for a reason other than store integrity,
 * e.g. the calling thread was interrupted while waiting for partition scans.
 */
public class QueryExecutionException extends RuntimeException {

    public QueryExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}

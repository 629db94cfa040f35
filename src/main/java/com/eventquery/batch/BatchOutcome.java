package com.eventquery.batch;

import lombok.Value;

/**
 * Result line of one batch query: rows written and time taken, or the error that
 * stopped it.
 */
@Value
public class BatchOutcome {

    int index;
    int rows;
    long timeMs;
    boolean cached;
    String error;

    public boolean isFailed() {
        return error != null;
    }
}

package com.eventquery.infrastructure.prepare;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Outcome of one preparation run.
 */
@Value
@Builder
public class PreparationReport {

    int filesRead;
    long eventsRead;
    long rowsRejected;
    int partitionsWritten;
    int partitionsSkipped;
    List<String> tablesBuilt;
    long elapsedMs;
}

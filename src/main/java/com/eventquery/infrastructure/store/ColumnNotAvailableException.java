package com.eventquery.infrastructure.store;

import com.eventquery.domain.model.EventColumn;
import lombok.Getter;

@Getter
public class ColumnNotAvailableException extends StoreIntegrityException {

    private final PartitionRef partition;
    private final EventColumn column;

    public ColumnNotAvailableException(PartitionRef partition, EventColumn column) {
        super("Column '" + column + "' is not available in partition " + partition);
        this.partition = partition;
        this.column = column;
    }
}

package com.eventquery.infrastructure.store;

import lombok.Getter;

@Getter
public class PartitionNotFoundException extends StoreIntegrityException {

    private final PartitionRef partition;

    public PartitionNotFoundException(PartitionRef partition) {
        super("Partition not found: " + partition);
        this.partition = partition;
    }

    public PartitionNotFoundException(PartitionRef partition, Throwable cause) {
        super("Partition not found: " + partition, cause);
        this.partition = partition;
    }
}

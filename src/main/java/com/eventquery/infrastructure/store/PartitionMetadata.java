package com.eventquery.infrastructure.store;

import com.eventquery.domain.model.EventKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.List;

/**
 * Per-partition statistics kept next to the column files.
 * {@code tsMin}/{@code tsMax} are null for an empty partition.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PartitionMetadata {

    private EventKind kind;
    private LocalDate day;
    private long rowCount;
    private Long tsMin;
    private Long tsMax;
    private List<String> columns;

    public PartitionRef ref() {
        return new PartitionRef(kind, day);
    }
}

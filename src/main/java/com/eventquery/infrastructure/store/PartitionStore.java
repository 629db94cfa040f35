package com.eventquery.infrastructure.store;

import com.eventquery.domain.model.EventColumn;
import com.eventquery.domain.model.EventKind;

import java.time.LocalDate;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Read side of the immutable (event kind, day) partitioned columnar store.
 */
public interface PartitionStore {

    /**
     * Partitions whose kind is in {@code kinds} and whose day lies in the inclusive range
     * [{@code fromDay}, {@code toDay}], in canonical order. A null argument leaves that
     * dimension unconstrained.
     */
    List<PartitionMetadata> listPartitions(Set<EventKind> kinds, LocalDate fromDay, LocalDate toDay);

    default List<PartitionMetadata> listPartitions() {
        return listPartitions(null, null, null);
    }

    /**
     * Stream the rows of one partition, reading only {@code columns}. Rows rejected by
     * {@code filter} are not handed to {@code sink}.
     *
     * @return number of rows passed to the sink
     * @throws PartitionNotFoundException if the partition is missing
     * @throws ColumnNotAvailableException if a column is neither stored nor derivable
     */
    long scan(PartitionRef partition, List<EventColumn> columns,
              Predicate<ProjectedRow> filter, Consumer<ProjectedRow> sink);

    /** Drop cached metadata so that newly written partitions become visible. */
    void refresh();
}

package com.eventquery.domain.plan;

import com.eventquery.domain.model.EventColumn;
import com.eventquery.domain.model.Filter;
import com.eventquery.domain.model.Query;
import com.eventquery.infrastructure.store.PartitionRef;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * Common shape of the two scan strategies: partitions in canonical order, the columns
 * to read from each, and the row filters not already settled by partition selection.
 */
@Getter
@ToString
@EqualsAndHashCode
public abstract class ScanPlan implements ExecutionPlan {

    private final Query query;
    private final List<PartitionRef> partitions;
    private final List<EventColumn> projectedColumns;
    private final List<Filter> residualFilters;

    protected ScanPlan(Query query, List<PartitionRef> partitions,
                       List<EventColumn> projectedColumns, List<Filter> residualFilters) {
        this.query = query;
        this.partitions = List.copyOf(partitions);
        this.projectedColumns = List.copyOf(projectedColumns);
        this.residualFilters = List.copyOf(residualFilters);
    }

    @Override
    public String describe() {
        return getClass().getSimpleName().replace("Plan", "") + "(partitions=" + partitions.size()
                + ", columns=" + projectedColumns + ", residual=" + residualFilters + ")";
    }
}

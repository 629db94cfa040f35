package com.eventquery.domain.plan;

import com.eventquery.domain.model.EventColumn;
import com.eventquery.domain.model.Filter;
import com.eventquery.domain.model.Query;
import com.eventquery.infrastructure.store.PartitionRef;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.List;

@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public class PartitionScanPlan extends ScanPlan {

    public PartitionScanPlan(Query query, List<PartitionRef> partitions,
                             List<EventColumn> projectedColumns, List<Filter> residualFilters) {
        super(query, partitions, projectedColumns, residualFilters);
    }

    @Override
    public PlanType getType() {
        return PlanType.PARTITION_SCAN;
    }
}

package com.eventquery.domain.plan;

import com.eventquery.domain.model.EventColumn;
import com.eventquery.domain.model.Filter;
import com.eventquery.domain.model.Query;
import com.eventquery.infrastructure.store.PartitionRef;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.List;

/**
 * Scan of every partition because no filter narrows kind or time. Executes exactly
 * like {@link PartitionScanPlan}; kept apart so the choice shows up in logs and metrics.
 */
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public class FullScanPlan extends ScanPlan {

    public FullScanPlan(Query query, List<PartitionRef> partitions,
                        List<EventColumn> projectedColumns, List<Filter> residualFilters) {
        super(query, partitions, projectedColumns, residualFilters);
    }

    @Override
    public PlanType getType() {
        return PlanType.FULL_SCAN;
    }
}

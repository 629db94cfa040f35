package com.eventquery.domain.plan;

import com.eventquery.domain.model.Filter;
import com.eventquery.domain.model.Query;
import com.eventquery.infrastructure.catalog.AggregateTableDefinition;
import lombok.Value;

import java.util.List;

/**
 * Answer from a precomputed table. {@code residualFilters} apply to the table's key
 * columns; {@code reaggregate} is set when the query groups by fewer columns than the
 * table is keyed by, so matching rows must be folded together.
 */
@Value
public class CatalogLookupPlan implements ExecutionPlan {

    Query query;
    AggregateTableDefinition table;
    List<Filter> residualFilters;
    boolean reaggregate;

    @Override
    public PlanType getType() {
        return PlanType.CATALOG_LOOKUP;
    }

    @Override
    public String describe() {
        return "CatalogLookup(table=" + table.getName() + ", residual=" + residualFilters
                + ", reaggregate=" + reaggregate + ")";
    }
}

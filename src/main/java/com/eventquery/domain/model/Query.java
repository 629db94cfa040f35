package com.eventquery.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Validated query over the {@code events} table.
 *
 * Built only by {@code QueryParser}; planner and executor rely on the invariants it
 * checks (known columns, group-by/select agreement, typed filter values).
 */
@Value
@Builder
public class Query {

    @Singular("select")
    List<SelectItem> select;

    @Singular("where")
    List<Filter> where;

    @Singular("groupBy")
    List<EventColumn> groupBy;

    @Singular("orderBy")
    List<OrderSpec> orderBy;

    public boolean isGrouped() {
        return !groupBy.isEmpty();
    }

    public boolean hasAggregates() {
        return select.stream().anyMatch(SelectItem::isAggregate);
    }

    public List<AggregateSelection> aggregates() {
        return select.stream()
                .filter(SelectItem::isAggregate)
                .map(AggregateSelection.class::cast)
                .collect(Collectors.toList());
    }

    public List<String> header() {
        return select.stream().map(SelectItem::outputName).collect(Collectors.toList());
    }

    public List<Filter> filtersOn(EventColumn column) {
        return where.stream().filter(filter -> filter.getColumn() == column).collect(Collectors.toList());
    }
}

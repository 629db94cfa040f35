package com.eventquery.infrastructure.catalog;

import com.eventquery.domain.model.AggregateFunction;
import com.eventquery.domain.model.AggregateSelection;
import com.eventquery.domain.model.EventColumn;
import com.eventquery.domain.model.EventKind;
import lombok.Value;

import java.util.Collection;
import java.util.Set;

/**
 * Structural identity of a precomputed aggregate: implicit kind filter (null when the
 * table spans all kinds), grouping columns, aggregate function and target column
 * (null for {@code COUNT(*)}).
 */
@Value
public class AggregateSignature {

    EventKind kindFilter;
    Set<EventColumn> groupColumns;
    AggregateFunction function;
    EventColumn column;

    public static AggregateSignature of(EventKind kindFilter, Collection<EventColumn> groupColumns,
                                        AggregateSelection aggregate) {
        return new AggregateSignature(kindFilter, Set.copyOf(groupColumns), aggregate.getFunction(), aggregate.getColumn());
    }
}

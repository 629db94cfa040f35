package com.eventquery.domain.model;

/**
 * One entry of a query's {@code select} list: either a bare column
 * ({@link ColumnSelection}) or an aggregate ({@link AggregateSelection}).
 */
public interface SelectItem {

    /** Header name of this output column, e.g. {@code day} or {@code SUM(bid_price)}. */
    String outputName();

    boolean isAggregate();
}

package com.eventquery.domain.model;

import lombok.Value;

/**
 * An aggregate output. {@code column} is null for {@code COUNT(*)}.
 */
@Value
public class AggregateSelection implements SelectItem {

    public static final String ALL_ROWS = "*";

    AggregateFunction function;
    EventColumn column;

    public static AggregateSelection countAll() {
        return new AggregateSelection(AggregateFunction.COUNT, null);
    }

    public boolean isCountAll() {
        return column == null;
    }

    @Override
    public String outputName() {
        return function.name() + "(" + (column == null ? ALL_ROWS : column.columnName()) + ")";
    }

    @Override
    public boolean isAggregate() {
        return true;
    }
}

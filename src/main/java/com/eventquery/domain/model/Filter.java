package com.eventquery.domain.model;

import lombok.Value;

import java.util.List;

/**
 * A single typed condition of a query's conjunctive {@code where} list.
 *
 * Values are already coerced to the column's {@link ColumnType}: one value for
 * {@code eq}/{@code neq}, one or more for {@code in}, exactly two for {@code between}.
 */
@Value
public class Filter {

    EventColumn column;
    FilterOperator operator;
    List<Object> values;

    public Filter(EventColumn column, FilterOperator operator, List<Object> values) {
        this.column = column;
        this.operator = operator;
        this.values = List.copyOf(values);
    }

    public static Filter eq(EventColumn column, Object value) {
        return new Filter(column, FilterOperator.EQ, List.of(column.type().coerce(value)));
    }

    public static Filter between(EventColumn column, Object low, Object high) {
        return new Filter(column, FilterOperator.BETWEEN,
                List.of(column.type().coerce(low), column.type().coerce(high)));
    }

    public Object value() {
        return values.get(0);
    }

    /**
     * Row-level evaluation. A null value never satisfies any operator.
     */
    public boolean test(Object value) {
        if (value == null) {
            return false;
        }
        switch (operator) {
            case EQ:
                return value.equals(values.get(0));
            case NEQ:
                return !value.equals(values.get(0));
            case IN:
                return values.contains(value);
            case BETWEEN:
                return compare(value, values.get(0)) >= 0 && compare(value, values.get(1)) <= 0;
            default:
                throw new IllegalStateException("Unhandled operator " + operator);
        }
    }

    /**
     * Whether some value inside the inclusive span [low, high] could satisfy this filter.
     * Used to prune partitions by their time span; never returns false for a span that
     * contains a matching value.
     */
    public boolean mayMatchWithin(Object low, Object high) {
        if (low == null || high == null) {
            return true;
        }
        switch (operator) {
            case EQ:
                return within(values.get(0), low, high);
            case NEQ:
                return !(low.equals(high) && low.equals(values.get(0)));
            case IN:
                return values.stream().anyMatch(candidate -> within(candidate, low, high));
            case BETWEEN:
                return compare(values.get(0), high) <= 0 && compare(values.get(1), low) >= 0;
            default:
                throw new IllegalStateException("Unhandled operator " + operator);
        }
    }

    private static boolean within(Object value, Object low, Object high) {
        return compare(value, low) >= 0 && compare(value, high) <= 0;
    }

    private static int compare(Object left, Object right) {
        return ColumnType.compareValues(left, right);
    }

    @Override
    public String toString() {
        return column + " " + operator.wireName() + " " + (values.size() == 1 ? values.get(0) : values);
    }
}

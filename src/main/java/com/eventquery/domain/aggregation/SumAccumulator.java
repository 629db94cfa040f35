package com.eventquery.domain.aggregation;

import com.eventquery.domain.exception.QueryExecutionException;
import com.eventquery.domain.model.ColumnType;

public class SumAccumulator extends Accumulator {

    private final ColumnType inputType;

    public SumAccumulator(ColumnType inputType) {
        this.inputType = inputType;
    }

    @Override
    public void add(Object value) {
        addNumber(value);
    }

    /** {@code Double} for a floating column, {@code Long} for an integer column; zero when empty. */
    @Override
    public Object finish() {
        if (inputType == ColumnType.DOUBLE) {
            return sum.doubleValue();
        }
        try {
            return sum.longValueExact();
        } catch (ArithmeticException e) {
            throw new QueryExecutionException("SUM of " + count + " values overflows a 64-bit integer: " + sum, e);
        }
    }
}

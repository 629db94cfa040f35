package com.eventquery.domain.aggregation;

/**
 * COUNT(*) counts rows; COUNT(column) counts non-null values.
 */
public class CountAccumulator extends Accumulator {

    private final boolean countRows;

    public CountAccumulator(boolean countRows) {
        this.countRows = countRows;
    }

    @Override
    public void add(Object value) {
        if (countRows || value != null) {
            count++;
        }
    }

    @Override
    public Object finish() {
        return count;
    }
}

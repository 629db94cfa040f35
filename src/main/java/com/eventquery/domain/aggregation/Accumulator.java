package com.eventquery.domain.aggregation;

import java.math.BigDecimal;

/**
 * Running state of one aggregate for one group.
 *
 * Every accumulator keeps the same exact state, a decimal sum of non-null inputs and a
 * count, so partial states merge by plain addition regardless of the order in which
 * partitions finish. Division for AVG happens only in {@link #finish()}.
 */
public abstract class Accumulator {

    protected BigDecimal sum = BigDecimal.ZERO;
    protected long count;

    public abstract void add(Object value);

    public abstract Object finish();

    /** Fold in a precomputed (sum, count) state, e.g. one row of an aggregate table. */
    public void addState(BigDecimal otherSum, long otherCount) {
        sum = sum.add(otherSum);
        count += otherCount;
    }

    public void merge(Accumulator other) {
        addState(other.sum, other.count);
    }

    public BigDecimal getSum() {
        return sum;
    }

    public long getCount() {
        return count;
    }

    protected void addNumber(Object value) {
        if (value == null) {
            return;
        }
        sum = sum.add(toDecimal(value));
        count++;
    }

    static BigDecimal toDecimal(Object value) {
        if (value instanceof Long || value instanceof Integer) {
            return BigDecimal.valueOf(((Number) value).longValue());
        }
        if (value instanceof Double) {
            return BigDecimal.valueOf((Double) value);
        }
        if (value instanceof BigDecimal) {
            return (BigDecimal) value;
        }
        throw new IllegalArgumentException("Cannot aggregate non-numeric value " + value);
    }
}

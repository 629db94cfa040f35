package com.eventquery.domain.aggregation;

import java.math.BigDecimal;
import java.math.MathContext;

public class AvgAccumulator extends Accumulator {

    @Override
    public void add(Object value) {
        addNumber(value);
    }

    /** Null when no non-null input was seen. */
    @Override
    public Object finish() {
        if (count == 0) {
            return null;
        }
        return sum.divide(BigDecimal.valueOf(count), MathContext.DECIMAL64).doubleValue();
    }
}

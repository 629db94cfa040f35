package com.eventquery.infrastructure.catalog;

import lombok.Value;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One group of a precomputed table: key values in key-column order plus the exact
 * accumulator state (sum of non-null values, count of values or rows).
 */
@Value
public class AggregateRow {

    List<Object> key;
    BigDecimal sum;
    long count;

    public AggregateRow(List<Object> key, BigDecimal sum, long count) {
        this.key = Collections.unmodifiableList(new ArrayList<>(key));
        this.sum = sum;
        this.count = count;
    }
}

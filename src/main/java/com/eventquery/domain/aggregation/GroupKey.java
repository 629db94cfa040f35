package com.eventquery.domain.aggregation;

import lombok.EqualsAndHashCode;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Tuple of group-by values. The empty key groups a whole input into one row.
 */
@EqualsAndHashCode
public final class GroupKey {

    public static final GroupKey EMPTY = new GroupKey(new Object[0]);

    private final List<Object> values;

    private GroupKey(Object[] values) {
        this.values = Collections.unmodifiableList(Arrays.asList(values));
    }

    public static GroupKey of(Object... values) {
        return values.length == 0 ? EMPTY : new GroupKey(values.clone());
    }

    public Object get(int index) {
        return values.get(index);
    }

    public List<Object> values() {
        return values;
    }

    @Override
    public String toString() {
        return values.toString();
    }
}

package com.eventquery.domain.aggregation;

import com.eventquery.domain.model.AggregateSelection;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Group key to accumulator mapping, built per partition and merged across partitions.
 *
 * Groups keep their first-arrival order. Merging partials in canonical partition order
 * therefore reproduces the order of a sequential scan, and the aggregate values do not
 * depend on merge order at all. Not thread-safe; each scan task owns its own instance.
 */
public class GroupedAggregation {

    private final List<AggregateSelection> aggregates;
    private final Map<GroupKey, Accumulator[]> groups = new LinkedHashMap<>();

    public GroupedAggregation(List<AggregateSelection> aggregates) {
        this.aggregates = List.copyOf(aggregates);
    }

    /** Accumulators of {@code key}, created empty on first use. */
    public Accumulator[] group(GroupKey key) {
        return groups.computeIfAbsent(key, k -> Accumulators.create(aggregates));
    }

    /** Add one input row; {@code inputs[i]} feeds the i-th aggregate. */
    public void accumulate(GroupKey key, Object... inputs) {
        Accumulator[] accumulators = group(key);
        for (int i = 0; i < accumulators.length; i++) {
            accumulators[i].add(inputs[i]);
        }
    }

    public GroupedAggregation merge(GroupedAggregation other) {
        for (Map.Entry<GroupKey, Accumulator[]> entry : other.groups.entrySet()) {
            Accumulator[] target = group(entry.getKey());
            Accumulator[] source = entry.getValue();
            for (int i = 0; i < target.length; i++) {
                target[i].merge(source[i]);
            }
        }
        return this;
    }

    public Map<GroupKey, Accumulator[]> groups() {
        return Collections.unmodifiableMap(groups);
    }

    public List<AggregateSelection> aggregates() {
        return aggregates;
    }

    public int size() {
        return groups.size();
    }

    public boolean isEmpty() {
        return groups.isEmpty();
    }
}

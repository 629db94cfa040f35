package com.eventquery.domain.aggregation;

import com.eventquery.domain.model.AggregateSelection;

import java.util.List;

public final class Accumulators {

    private Accumulators() {
    }

    public static Accumulator create(AggregateSelection aggregate) {
        switch (aggregate.getFunction()) {
            case SUM:
                return new SumAccumulator(aggregate.getColumn().type());
            case COUNT:
                return new CountAccumulator(aggregate.isCountAll());
            case AVG:
                return new AvgAccumulator();
            default:
                throw new IllegalStateException("Unhandled aggregate " + aggregate.getFunction());
        }
    }

    public static Accumulator[] create(List<AggregateSelection> aggregates) {
        Accumulator[] accumulators = new Accumulator[aggregates.size()];
        for (int i = 0; i < accumulators.length; i++) {
            accumulators[i] = create(aggregates.get(i));
        }
        return accumulators;
    }
}

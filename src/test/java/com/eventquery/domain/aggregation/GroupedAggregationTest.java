package com.eventquery.domain.aggregation;

import com.eventquery.domain.exception.QueryExecutionException;
import com.eventquery.domain.model.AggregateFunction;
import com.eventquery.domain.model.AggregateSelection;
import com.eventquery.domain.model.ColumnType;
import com.eventquery.domain.model.EventColumn;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Partial aggregations must merge to the same state whatever the split and order.
 */
class GroupedAggregationTest {

    private static final List<AggregateSelection> AGGREGATES = List.of(
            new AggregateSelection(AggregateFunction.SUM, EventColumn.BID_PRICE),
            AggregateSelection.countAll(),
            new AggregateSelection(AggregateFunction.AVG, EventColumn.BID_PRICE),
            new AggregateSelection(AggregateFunction.COUNT, EventColumn.BID_PRICE));

    @Test
    void testMerge_SplitEqualsWhole() {
        // Given
        Random random = new Random(42);
        List<Object[]> rows = new ArrayList<>();
        for (int i = 0; i < 500; i++) {
            String country = "C" + random.nextInt(5);
            Double price = random.nextInt(10) == 0 ? null : random.nextInt(10_000) / 100.0;
            rows.add(new Object[]{country, price});
        }

        // When
        GroupedAggregation whole = aggregate(rows.subList(0, rows.size()));
        for (int split : new int[]{0, 1, 137, 250, 499, 500}) {
            GroupedAggregation left = aggregate(rows.subList(0, split));
            GroupedAggregation right = aggregate(rows.subList(split, rows.size()));
            GroupedAggregation reversed = aggregate(rows.subList(split, rows.size()))
                    .merge(aggregate(rows.subList(0, split)));

            // Then
            assertSameState(whole, left.merge(right));
            assertSameState(whole, reversed);
        }
    }

    @Test
    void testGroups_KeepFirstArrivalOrder() {
        GroupedAggregation aggregation = new GroupedAggregation(List.of(AggregateSelection.countAll()));
        aggregation.accumulate(GroupKey.of("b"), (Object) null);
        aggregation.accumulate(GroupKey.of("a"), (Object) null);
        aggregation.accumulate(GroupKey.of("b"), (Object) null);

        assertEquals(List.of(GroupKey.of("b"), GroupKey.of("a")), new ArrayList<>(aggregation.groups().keySet()));
        assertEquals(2L, aggregation.groups().get(GroupKey.of("b"))[0].finish());
    }

    @Test
    void testFinish_Types() {
        Accumulator sumDouble = Accumulators.create(new AggregateSelection(AggregateFunction.SUM, EventColumn.BID_PRICE));
        Accumulator sumLong = Accumulators.create(new AggregateSelection(AggregateFunction.SUM, EventColumn.USER_ID));
        Accumulator avg = Accumulators.create(new AggregateSelection(AggregateFunction.AVG, EventColumn.BID_PRICE));
        Accumulator count = Accumulators.create(new AggregateSelection(AggregateFunction.COUNT, EventColumn.BID_PRICE));

        // nothing seen yet
        assertEquals(0.0, sumDouble.finish());
        assertEquals(0L, sumLong.finish());
        assertNull(avg.finish());
        assertEquals(0L, count.finish());

        sumDouble.add(0.1);
        sumDouble.add(0.2);
        sumLong.add(3L);
        sumLong.add(null);
        avg.add(1.0);
        avg.add(2.0);
        count.add(null);
        count.add(4.0);

        // exact decimal addition, no binary rounding drift
        assertEquals(0.3, sumDouble.finish());
        assertEquals(3L, sumLong.finish());
        assertEquals(1.5, avg.finish());
        assertEquals(1L, count.finish());
    }

    @Test
    void testAddState_SeedsFromPrecomputedRow() {
        Accumulator avg = Accumulators.create(new AggregateSelection(AggregateFunction.AVG, EventColumn.BID_PRICE));
        avg.addState(new BigDecimal("6.0"), 3);
        avg.addState(new BigDecimal("9.0"), 2);

        assertEquals(3.0, avg.finish());
        assertEquals(5L, avg.getCount());
    }

    private static GroupedAggregation aggregate(List<Object[]> rows) {
        GroupedAggregation aggregation = new GroupedAggregation(AGGREGATES);
        for (Object[] row : rows) {
            aggregation.accumulate(GroupKey.of(row[0]), row[1], null, row[1], row[1]);
        }
        return aggregation;
    }

    private static void assertSameState(GroupedAggregation expected, GroupedAggregation actual) {
        assertEquals(expected.groups().keySet(), actual.groups().keySet());
        expected.groups().forEach((key, accumulators) -> {
            Accumulator[] other = actual.groups().get(key);
            for (int i = 0; i < accumulators.length; i++) {
                assertEquals(0, accumulators[i].getSum().compareTo(other[i].getSum()), "sum of " + key);
                assertEquals(accumulators[i].getCount(), other[i].getCount(), "count of " + key);
                Object left = accumulators[i].finish();
                Object right = other[i].finish();
                if (left instanceof Double) {
                    assertEquals((Double) left, (Double) right, 1e-9);
                } else {
                    assertEquals(left, right);
                }
            }
        });
    }

    @Test
    void testFinish_LongSumOverflowFails() {
        // Given
        SumAccumulator sum = new SumAccumulator(ColumnType.LONG);
        sum.add(Long.MAX_VALUE);
        sum.add(1L);

        // When / Then
        QueryExecutionException error = assertThrows(QueryExecutionException.class, sum::finish);
        assertTrue(error.getMessage().contains("9223372036854775808"));
    }

    @Test
    void testFinish_LongSumAtLimit() {
        SumAccumulator sum = new SumAccumulator(ColumnType.LONG);
        sum.add(Long.MAX_VALUE - 1);
        sum.add(1L);

        assertEquals(Long.MAX_VALUE, sum.finish());
    }
}

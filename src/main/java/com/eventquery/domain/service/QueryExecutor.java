package com.eventquery.domain.service;

import com.eventquery.domain.aggregation.Accumulator;
import com.eventquery.domain.aggregation.GroupKey;
import com.eventquery.domain.aggregation.GroupedAggregation;
import com.eventquery.domain.exception.QueryExecutionException;
import com.eventquery.domain.model.ColumnSelection;
import com.eventquery.domain.model.ColumnType;
import com.eventquery.domain.model.EventColumn;
import com.eventquery.domain.model.Filter;
import com.eventquery.domain.model.OrderSpec;
import com.eventquery.domain.model.Query;
import com.eventquery.domain.model.QueryResult;
import com.eventquery.domain.model.SelectItem;
import com.eventquery.domain.plan.CatalogLookupPlan;
import com.eventquery.domain.plan.ExecutionPlan;
import com.eventquery.domain.plan.ScanPlan;
import com.eventquery.infrastructure.catalog.AggregateCatalog;
import com.eventquery.infrastructure.catalog.AggregateRow;
import com.eventquery.infrastructure.catalog.AggregateTable;
import com.eventquery.infrastructure.catalog.AggregateTableDefinition;
import com.eventquery.infrastructure.store.PartitionRef;
import com.eventquery.infrastructure.store.PartitionStore;
import com.eventquery.infrastructure.store.ProjectedRow;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.function.Predicate;

/**
 * Runs execution plans.
 *
 * Scan plans fan out one task per partition on the scan pool. Each task owns its own
 * partial result; partials are merged on the calling thread in the plan's partition
 * order, so output does not depend on which partition finishes first. A failure in any
 * partition cancels the rest and aborts the query with the store's exception.
 */
@Slf4j
@Service
public class QueryExecutor {

    private final PartitionStore partitionStore;
    private final AggregateCatalog aggregateCatalog;
    private final ExecutorService scanExecutor;
    private final MeterRegistry meterRegistry;

    public QueryExecutor(PartitionStore partitionStore,
                         AggregateCatalog aggregateCatalog,
                         @Qualifier("scanExecutor") ExecutorService scanExecutor,
                         MeterRegistry meterRegistry) {
        this.partitionStore = partitionStore;
        this.aggregateCatalog = aggregateCatalog;
        this.scanExecutor = scanExecutor;
        this.meterRegistry = meterRegistry;
    }

    public QueryResult execute(ExecutionPlan plan) {
        if (plan instanceof CatalogLookupPlan) {
            return executeLookup((CatalogLookupPlan) plan);
        }
        if (plan instanceof ScanPlan) {
            return executeScan((ScanPlan) plan);
        }
        throw new IllegalArgumentException("Unsupported plan " + plan);
    }

    /**
     * Scan and aggregate without finalizing, leaving the exact (sum, count) state of every
     * group available. Used to build aggregate tables.
     */
    public GroupedAggregation aggregate(ScanPlan plan) {
        return scanPartitions(plan).aggregation;
    }

    private QueryResult executeLookup(CatalogLookupPlan plan) {
        Query query = plan.getQuery();
        AggregateTableDefinition definition = plan.getTable();
        AggregateTable table = aggregateCatalog.load(definition);

        int[] filterIndexes = plan.getResidualFilters().stream()
                .mapToInt(filter -> definition.keyIndex(filter.getColumn()))
                .toArray();
        int[] groupIndexes = query.getGroupBy().stream()
                .mapToInt(definition::keyIndex)
                .toArray();

        GroupedAggregation aggregation = new GroupedAggregation(query.aggregates());
        long matched = 0;
        for (AggregateRow row : table.getRows()) {
            if (!matchesKey(row, plan.getResidualFilters(), filterIndexes)) {
                continue;
            }
            matched++;
            Object[] keyValues = new Object[groupIndexes.length];
            for (int i = 0; i < groupIndexes.length; i++) {
                keyValues[i] = row.getKey().get(groupIndexes[i]);
            }
            for (Accumulator accumulator : aggregation.group(GroupKey.of(keyValues))) {
                accumulator.addState(row.getSum(), row.getCount());
            }
        }
        log.debug("Catalog table {}: {} of {} rows matched", definition.getName(), matched, table.getRows().size());

        return QueryResult.builder()
                .columns(query.header())
                .rows(finishGroups(query, aggregation))
                .planType(plan.getType())
                .partitionsScanned(0)
                .rowsMatched(matched)
                .build();
    }

    private static boolean matchesKey(AggregateRow row, List<Filter> filters, int[] indexes) {
        for (int i = 0; i < indexes.length; i++) {
            if (!filters.get(i).test(row.getKey().get(indexes[i]))) {
                return false;
            }
        }
        return true;
    }

    private QueryResult executeScan(ScanPlan plan) {
        Query query = plan.getQuery();
        PartialResult merged = scanPartitions(plan);

        List<List<Object>> rows = merged.aggregation != null
                ? finishGroups(query, merged.aggregation)
                : sort(query, merged.rows);

        return QueryResult.builder()
                .columns(query.header())
                .rows(rows)
                .planType(plan.getType())
                .partitionsScanned(plan.getPartitions().size())
                .rowsMatched(merged.matched)
                .build();
    }

    private PartialResult scanPartitions(ScanPlan plan) {
        Query query = plan.getQuery();
        boolean aggregating = query.hasAggregates() || query.isGrouped();
        RowLayout layout = new RowLayout(query, plan.getProjectedColumns());
        Predicate<ProjectedRow> filter = rowFilter(plan.getResidualFilters(), plan.getProjectedColumns());

        List<Future<PartialResult>> futures = new ArrayList<>(plan.getPartitions().size());
        for (PartitionRef partition : plan.getPartitions()) {
            futures.add(scanExecutor.submit(() -> scanPartition(partition, plan, layout, filter, aggregating)));
        }

        PartialResult merged = aggregating
                ? new PartialResult(new GroupedAggregation(query.aggregates()), null)
                : new PartialResult(null, new ArrayList<>());
        try {
            for (Future<PartialResult> future : futures) {
                merged.merge(future.get());
            }
        } catch (ExecutionException e) {
            futures.forEach(future -> future.cancel(true));
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new QueryExecutionException("Partition scan failed", cause);
        } catch (InterruptedException e) {
            futures.forEach(future -> future.cancel(true));
            Thread.currentThread().interrupt();
            throw new QueryExecutionException("Interrupted while scanning partitions", e);
        }

        Counter.builder("store.partitions.scanned")
                .tag("plan", plan.getType().name().toLowerCase())
                .register(meterRegistry)
                .increment(plan.getPartitions().size());

        return merged;
    }

    private PartialResult scanPartition(PartitionRef partition, ScanPlan plan, RowLayout layout,
                                        Predicate<ProjectedRow> filter, boolean aggregating) {
        List<EventColumn> columns = plan.getProjectedColumns();
        PartialResult partial;
        long matched;
        if (aggregating) {
            GroupedAggregation aggregation = new GroupedAggregation(plan.getQuery().aggregates());
            matched = partitionStore.scan(partition, columns, filter,
                    row -> aggregation.accumulate(layout.groupKey(row), layout.aggregateInputs(row)));
            partial = new PartialResult(aggregation, null);
        } else {
            List<List<Object>> rows = new ArrayList<>();
            matched = partitionStore.scan(partition, columns, filter, row -> rows.add(layout.selectValues(row)));
            partial = new PartialResult(null, rows);
        }
        partial.matched = matched;
        log.trace("Scanned {}: {} rows matched", partition, matched);
        return partial;
    }

    private static Predicate<ProjectedRow> rowFilter(List<Filter> filters, List<EventColumn> columns) {
        if (filters.isEmpty()) {
            return row -> true;
        }
        int[] indexes = filters.stream().mapToInt(filter -> columns.indexOf(filter.getColumn())).toArray();
        return row -> {
            for (int i = 0; i < indexes.length; i++) {
                if (!filters.get(i).test(row.get(indexes[i]))) {
                    return false;
                }
            }
            return true;
        };
    }

    /**
     * One output row per group in first-arrival order, then sorted. An ungrouped aggregate
     * query always produces exactly one row.
     */
    private static List<List<Object>> finishGroups(Query query, GroupedAggregation aggregation) {
        if (!query.isGrouped() && query.hasAggregates() && aggregation.isEmpty()) {
            aggregation.group(GroupKey.EMPTY);
        }
        List<List<Object>> rows = new ArrayList<>(aggregation.size());
        for (Map.Entry<GroupKey, Accumulator[]> group : aggregation.groups().entrySet()) {
            List<Object> row = new ArrayList<>(query.getSelect().size());
            int aggregateIndex = 0;
            for (SelectItem item : query.getSelect()) {
                if (item.isAggregate()) {
                    row.add(group.getValue()[aggregateIndex++].finish());
                } else {
                    row.add(group.getKey().get(query.getGroupBy().indexOf(((ColumnSelection) item).getColumn())));
                }
            }
            rows.add(row);
        }
        return sort(query, rows);
    }

    private static List<List<Object>> sort(Query query, List<List<Object>> rows) {
        if (query.getOrderBy().isEmpty()) {
            return rows;
        }
        Comparator<List<Object>> comparator = null;
        for (OrderSpec order : query.getOrderBy()) {
            Comparator<List<Object>> next = (left, right) ->
                    compareValues(left.get(order.getOutputIndex()), right.get(order.getOutputIndex()), order.isDescending());
            comparator = comparator == null ? next : comparator.thenComparing(next);
        }
        rows.sort(comparator);
        return rows;
    }

    /** Nulls last in either direction. */
    private static int compareValues(Object left, Object right, boolean descending) {
        if (left == null) {
            return right == null ? 0 : 1;
        }
        if (right == null) {
            return -1;
        }
        int result = ColumnType.compareValues(left, right);
        return descending ? -result : result;
    }

    /** Positions of group-by, aggregate-input and select columns within the projection. */
    private static final class RowLayout {

        private final int[] groupIndexes;
        private final int[] aggregateIndexes;
        private final int[] selectIndexes;

        private RowLayout(Query query, List<EventColumn> projection) {
            this.groupIndexes = query.getGroupBy().stream().mapToInt(projection::indexOf).toArray();
            this.aggregateIndexes = query.aggregates().stream()
                    .mapToInt(aggregate -> aggregate.isCountAll() ? -1 : projection.indexOf(aggregate.getColumn()))
                    .toArray();
            this.selectIndexes = query.getSelect().stream()
                    .filter(item -> !item.isAggregate())
                    .mapToInt(item -> projection.indexOf(((ColumnSelection) item).getColumn()))
                    .toArray();
        }

        GroupKey groupKey(ProjectedRow row) {
            if (groupIndexes.length == 0) {
                return GroupKey.EMPTY;
            }
            Object[] values = new Object[groupIndexes.length];
            for (int i = 0; i < values.length; i++) {
                values[i] = row.get(groupIndexes[i]);
            }
            return GroupKey.of(values);
        }

        Object[] aggregateInputs(ProjectedRow row) {
            Object[] inputs = new Object[aggregateIndexes.length];
            for (int i = 0; i < inputs.length; i++) {
                inputs[i] = aggregateIndexes[i] < 0 ? null : row.get(aggregateIndexes[i]);
            }
            return inputs;
        }

        List<Object> selectValues(ProjectedRow row) {
            List<Object> values = new ArrayList<>(selectIndexes.length);
            for (int index : selectIndexes) {
                values.add(row.get(index));
            }
            return values;
        }
    }

    /** Output of one partition task, or the running merge of several. */
    private static final class PartialResult {

        private final GroupedAggregation aggregation;
        private final List<List<Object>> rows;
        private long matched;

        private PartialResult(GroupedAggregation aggregation, List<List<Object>> rows) {
            this.aggregation = aggregation;
            this.rows = rows;
        }

        void merge(PartialResult other) {
            if (aggregation != null) {
                aggregation.merge(other.aggregation);
            } else {
                rows.addAll(other.rows);
            }
            matched += other.matched;
        }
    }
}

package com.eventquery.domain.service;

import com.eventquery.domain.exception.InvalidQueryException;
import com.eventquery.domain.model.AggregateSelection;
import com.eventquery.domain.model.ColumnSelection;
import com.eventquery.domain.model.DerivedColumns;
import com.eventquery.domain.model.EventColumn;
import com.eventquery.domain.model.EventKind;
import com.eventquery.domain.model.Filter;
import com.eventquery.domain.model.FilterOperator;
import com.eventquery.domain.model.Query;
import com.eventquery.domain.model.SelectItem;
import com.eventquery.domain.plan.CatalogLookupPlan;
import com.eventquery.domain.plan.ExecutionPlan;
import com.eventquery.domain.plan.FullScanPlan;
import com.eventquery.domain.plan.PartitionScanPlan;
import com.eventquery.domain.plan.ScanPlan;
import com.eventquery.infrastructure.catalog.AggregateCatalog;
import com.eventquery.infrastructure.catalog.AggregateTableDefinition;
import com.eventquery.infrastructure.store.PartitionMetadata;
import com.eventquery.infrastructure.store.PartitionRef;
import com.eventquery.infrastructure.store.PartitionStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Chooses how to answer a query.
 *
 * Planning Flow:
 * 1. Try the aggregate catalog: a precomputed table answers the query when it carries
 *    the same kind filter, produces every selected aggregate, is keyed by a superset of
 *    the group-by columns and every other filter is on one of its key columns
 * 2. Otherwise prune partitions: kind/day/week filters are evaluated exactly against
 *    each partition key, ts/hour/minute filters against the partition's time span
 * 3. With no filter able to prune, fall back to a full scan
 *
 * Among several matching tables the one with the fewest key columns wins.
 */
@Slf4j
@Service
public class QueryPlanner {

    private final PartitionStore partitionStore;
    private final AggregateCatalog aggregateCatalog;
    private final boolean catalogEnabled;

    public QueryPlanner(PartitionStore partitionStore,
                        AggregateCatalog aggregateCatalog,
                        @Value("${app.catalog.enabled:true}") boolean catalogEnabled) {
        this.partitionStore = partitionStore;
        this.aggregateCatalog = aggregateCatalog;
        this.catalogEnabled = catalogEnabled;
    }

    public ExecutionPlan plan(Query query) {
        if (query == null || query.getSelect().isEmpty()) {
            throw new InvalidQueryException("Nothing to select");
        }
        if (catalogEnabled) {
            Optional<CatalogLookupPlan> lookup = matchCatalog(query);
            if (lookup.isPresent()) {
                log.debug("Planned {}", lookup.get().describe());
                return lookup.get();
            }
        }
        ScanPlan scan = planScan(query);
        log.debug("Planned {}", scan.describe());
        return scan;
    }

    /**
     * Scan plan for the query, never consulting the catalog. Also used to build the
     * catalog's tables.
     */
    public ScanPlan planScan(Query query) {
        List<Filter> pruningFilters = query.getWhere().stream()
                .filter(filter -> filter.getColumn().isPruningColumn())
                .collect(Collectors.toList());

        List<PartitionRef> partitions = partitionStore
                .listPartitions(kindBound(query), dayLowerBound(query), dayUpperBound(query))
                .stream()
                .filter(partition -> pruningFilters.stream().allMatch(filter -> mayContain(partition, filter)))
                .map(PartitionMetadata::ref)
                .sorted()
                .collect(Collectors.toList());

        List<Filter> residual = query.getWhere().stream()
                .filter(filter -> !filter.getColumn().isPartitionKey())
                .collect(Collectors.toList());

        List<EventColumn> projection = projection(query, residual);

        if (pruningFilters.isEmpty()) {
            return new FullScanPlan(query, partitions, projection, residual);
        }
        return new PartitionScanPlan(query, partitions, projection, residual);
    }

    private Optional<CatalogLookupPlan> matchCatalog(Query query) {
        List<AggregateSelection> aggregates = query.aggregates();
        if (aggregates.isEmpty()) {
            return Optional.empty();
        }

        EventKind kind = singleKind(query);
        List<EventKind> kindFilters = kind == null ? Arrays.asList((EventKind) null) : Arrays.asList(kind, null);

        CatalogLookupPlan best = null;
        for (EventKind kindFilter : kindFilters) {
            for (AggregateTableDefinition table : aggregateCatalog.candidates(kindFilter, aggregates.get(0))) {
                CatalogLookupPlan candidate = tryTable(query, table, aggregates);
                if (candidate != null && (best == null
                        || table.getKeyColumns().size() < best.getTable().getKeyColumns().size())) {
                    best = candidate;
                }
            }
        }
        return Optional.ofNullable(best);
    }

    private CatalogLookupPlan tryTable(Query query, AggregateTableDefinition table, List<AggregateSelection> aggregates) {
        if (!aggregates.stream().allMatch(table::supports)) {
            return null;
        }
        if (!table.getKeyColumns().containsAll(query.getGroupBy())) {
            return null;
        }
        List<Filter> residual = new ArrayList<>();
        for (Filter filter : query.getWhere()) {
            if (filter.getColumn() == EventColumn.TYPE && table.getKindFilter() != null) {
                // singleKind() already matched the table's kind
                continue;
            }
            if (!table.getKeyColumns().contains(filter.getColumn())) {
                return null;
            }
            residual.add(filter);
        }
        if (!aggregateCatalog.isMaterialized(table)) {
            log.debug("Table {} matches but has not been built", table.getName());
            return null;
        }
        boolean reaggregate = !new HashSet<>(query.getGroupBy()).equals(new HashSet<>(table.getKeyColumns()));
        return new CatalogLookupPlan(query, table, residual, reaggregate);
    }

    /** The kind pinned by a single {@code type = x} filter, or null. */
    private static EventKind singleKind(Query query) {
        List<Filter> typeFilters = query.filtersOn(EventColumn.TYPE);
        if (typeFilters.size() == 1 && typeFilters.get(0).getOperator() == FilterOperator.EQ) {
            return EventKind.fromWireName((String) typeFilters.get(0).value());
        }
        return null;
    }

    private static boolean mayContain(PartitionMetadata partition, Filter filter) {
        Long tsMin = partition.getTsMin();
        Long tsMax = partition.getTsMax();
        switch (filter.getColumn()) {
            case TYPE:
                return filter.test(partition.getKind().wireName());
            case DAY:
                return filter.test(partition.getDay());
            case WEEK:
                return filter.test(DerivedColumns.weekOf(partition.getDay()));
            case TS:
                return filter.mayMatchWithin(tsMin, tsMax);
            case HOUR:
                return tsMin == null || filter.mayMatchWithin(DerivedColumns.hour(tsMin), DerivedColumns.hour(tsMax));
            case MINUTE:
                return tsMin == null || filter.mayMatchWithin(DerivedColumns.minute(tsMin), DerivedColumns.minute(tsMax));
            default:
                return true;
        }
    }

    /** Kinds allowed by eq/in filters on {@code type}, or null when unconstrained. */
    private static Set<EventKind> kindBound(Query query) {
        Set<EventKind> kinds = null;
        for (Filter filter : query.filtersOn(EventColumn.TYPE)) {
            if (filter.getOperator() != FilterOperator.EQ && filter.getOperator() != FilterOperator.IN) {
                continue;
            }
            Set<EventKind> allowed = filter.getValues().stream()
                    .map(value -> EventKind.fromWireName((String) value))
                    .collect(Collectors.toCollection(() -> EnumSet.noneOf(EventKind.class)));
            if (kinds == null) {
                kinds = allowed;
            } else {
                kinds.retainAll(allowed);
            }
        }
        return kinds;
    }

    private static LocalDate dayLowerBound(Query query) {
        LocalDate bound = null;
        for (Filter filter : query.filtersOn(EventColumn.DAY)) {
            if (filter.getOperator() == FilterOperator.EQ || filter.getOperator() == FilterOperator.BETWEEN) {
                LocalDate low = (LocalDate) filter.getValues().get(0);
                bound = bound == null || low.isAfter(bound) ? low : bound;
            }
        }
        return bound;
    }

    private static LocalDate dayUpperBound(Query query) {
        LocalDate bound = null;
        for (Filter filter : query.filtersOn(EventColumn.DAY)) {
            if (filter.getOperator() == FilterOperator.EQ || filter.getOperator() == FilterOperator.BETWEEN) {
                LocalDate high = (LocalDate) filter.getValues().get(filter.getValues().size() - 1);
                bound = bound == null || high.isBefore(bound) ? high : bound;
            }
        }
        return bound;
    }

    /**
     * Columns a scan must read: selected and grouped columns, residual filter columns and
     * aggregate inputs, in schema order.
     */
    private static List<EventColumn> projection(Query query, List<Filter> residual) {
        Set<EventColumn> columns = EnumSet.noneOf(EventColumn.class);
        for (SelectItem item : query.getSelect()) {
            if (item instanceof ColumnSelection) {
                columns.add(((ColumnSelection) item).getColumn());
            } else if (!((AggregateSelection) item).isCountAll()) {
                columns.add(((AggregateSelection) item).getColumn());
            }
        }
        columns.addAll(query.getGroupBy());
        residual.forEach(filter -> columns.add(filter.getColumn()));
        return new ArrayList<>(columns);
    }
}

package com.eventquery.domain.service;

import com.eventquery.domain.exception.InvalidQueryException;
import com.eventquery.domain.model.EventColumn;
import com.eventquery.domain.model.PlanDescription;
import com.eventquery.domain.model.Query;
import com.eventquery.domain.model.QueryRequest;
import com.eventquery.domain.model.QueryResult;
import com.eventquery.domain.plan.CatalogLookupPlan;
import com.eventquery.domain.plan.ExecutionPlan;
import com.eventquery.domain.plan.PlanType;
import com.eventquery.domain.plan.ScanPlan;
import com.eventquery.infrastructure.cache.QueryCacheService;
import com.eventquery.infrastructure.store.PartitionMetadata;
import com.eventquery.infrastructure.store.PartitionStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Query service for the event store.
 *
 * Query Flow:
 * 1. Parse and validate the request (invalid queries never reach the cache or the store)
 * 2. Check the result cache
 * 3. On a miss, plan and execute
 * 4. Store the result in the cache (failed queries are never cached)
 * 5. Return result
 *
 * Every query is timed and counted by plan type and outcome.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QueryService {

    private final QueryParser queryParser;
    private final QueryPlanner queryPlanner;
    private final QueryExecutor queryExecutor;
    private final QueryCacheService cacheService;
    private final PartitionStore partitionStore;
    private final MeterRegistry meterRegistry;

    public QueryResult execute(QueryRequest request) {
        Query query = parse(request);
        Timer.Sample sample = Timer.start(meterRegistry);
        long startTime = System.currentTimeMillis();

        try {
            QueryResult result = cacheService.getOrCompute(query, () -> run(query));

            Counter.builder("query.cache")
                    .tag("result", result.isCached() ? "hit" : "miss")
                    .register(meterRegistry)
                    .increment();

            long queryTime = System.currentTimeMillis() - startTime;
            result.setQueryTimeMs(queryTime);

            String plan = planTag(result.getPlanType());
            sample.stop(Timer.builder("query.latency")
                    .tag("plan", plan)
                    .tag("cached", String.valueOf(result.isCached()))
                    .register(meterRegistry));

            Counter.builder("query.executed")
                    .tag("plan", plan)
                    .tag("result", "success")
                    .register(meterRegistry)
                    .increment();

            log.info("Query executed: {} rows, plan={}, cached={}, {} ms",
                    result.getRowCount(), result.getPlanType(), result.isCached(), queryTime);

            return result;

        } catch (RuntimeException e) {
            log.error("Error executing query: {}", e.getMessage(), e);

            Counter.builder("query.executed")
                    .tag("plan", "unknown")
                    .tag("result", "error")
                    .register(meterRegistry)
                    .increment();

            throw e;
        }
    }

    /**
     * Plan a query without executing it.
     */
    public PlanDescription explain(QueryRequest request) {
        Query query = parse(request);
        ExecutionPlan plan = queryPlanner.plan(query);

        PlanDescription.PlanDescriptionBuilder description = PlanDescription.builder()
                .planType(plan.getType())
                .description(plan.describe());
        if (plan instanceof CatalogLookupPlan) {
            CatalogLookupPlan lookup = (CatalogLookupPlan) plan;
            description.table(lookup.getTable().getName())
                    .reaggregate(lookup.isReaggregate())
                    .residualFilters(render(lookup.getResidualFilters()));
        } else {
            ScanPlan scan = (ScanPlan) plan;
            description.partitions(scan.getPartitions().stream().map(Object::toString).collect(Collectors.toList()))
                    .projectedColumns(scan.getProjectedColumns().stream()
                            .map(EventColumn::columnName)
                            .collect(Collectors.toList()))
                    .residualFilters(render(scan.getResidualFilters()));
        }
        return description.build();
    }

    public List<PartitionMetadata> listPartitions() {
        return partitionStore.listPartitions();
    }

    public void invalidateCache() {
        cacheService.invalidateAll();
    }

    private Query parse(QueryRequest request) {
        try {
            return queryParser.parse(request);
        } catch (InvalidQueryException e) {
            log.warn("Rejected query: {}", e.getMessage());

            Counter.builder("query.executed")
                    .tag("plan", "none")
                    .tag("result", "invalid")
                    .register(meterRegistry)
                    .increment();

            throw e;
        }
    }

    private QueryResult run(Query query) {
        ExecutionPlan plan = queryPlanner.plan(query);
        log.debug("Executing {}", plan.describe());
        return queryExecutor.execute(plan);
    }

    private static List<String> render(List<?> filters) {
        return filters.stream().map(Object::toString).collect(Collectors.toList());
    }

    private static String planTag(PlanType type) {
        return type == null ? "unknown" : type.name().toLowerCase();
    }
}

package com.eventquery.infrastructure.cache;

import com.eventquery.domain.model.AggregateSelection;
import com.eventquery.domain.model.ColumnSelection;
import com.eventquery.domain.model.ColumnType;
import com.eventquery.domain.model.EventColumn;
import com.eventquery.domain.model.Filter;
import com.eventquery.domain.model.FilterOperator;
import com.eventquery.domain.model.OrderSpec;
import com.eventquery.domain.model.Query;
import com.eventquery.domain.model.QueryResult;
import com.eventquery.domain.model.SelectItem;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.DigestUtils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * In-process cache of query results.
 *
 * Uses a size-bounded Caffeine cache keyed by an MD5 of the query's canonical form, so
 * two queries differing only in filter order, {@code in} list order or duplicates share
 * one entry.
 *
 * Caching Strategy:
 * - Results are copied on the way in and on the way out; callers may mutate what they get
 * - No TTL: the store is append-only, and every preparation run calls {@link #invalidateAll()}
 * - A computation that throws leaves no entry behind
 *
 * Concurrency: {@link #getOrCompute} computes at most once per key at a time; other keys
 * proceed independently.
 */
@Slf4j
@Service
public class QueryCacheService {

    private static final String KEY_PREFIX = "query:";

    private final ObjectMapper canonicalMapper;
    private final Cache<String, QueryResult> cache;
    private final boolean enabled;

    public QueryCacheService(ObjectMapper objectMapper,
                             @Value("${app.cache.enabled:true}") boolean enabled,
                             @Value("${app.cache.max-entries:1000}") long maxEntries) {
        this.canonicalMapper = objectMapper.copy()
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
        this.enabled = enabled;
        this.cache = Caffeine.newBuilder()
                .maximumSize(maxEntries)
                .build();
    }

    /**
     * Get cached query result.
     */
    public Optional<QueryResult> get(Query query) {
        if (!enabled) {
            return Optional.empty();
        }
        String key = generateCacheKey(query);
        QueryResult cached = cache.getIfPresent(key);
        if (cached == null) {
            log.debug("Cache miss for key: {}", key);
            return Optional.empty();
        }
        log.debug("Cache hit for key: {}", key);
        return Optional.of(cached.deepCopy());
    }

    /**
     * Store query result in cache.
     */
    public void put(Query query, QueryResult result) {
        if (!enabled) {
            return;
        }
        String key = generateCacheKey(query);
        cache.put(key, result.deepCopy());
        log.debug("Cached result for key: {} ({} rows)", key, result.getRowCount());
    }

    /**
     * Return the cached result or compute, store and return it. The returned copy has
     * {@code cached} set when it came from the cache.
     */
    public QueryResult getOrCompute(Query query, Supplier<QueryResult> compute) {
        if (!enabled) {
            return compute.get();
        }
        String key = generateCacheKey(query);
        AtomicBoolean computed = new AtomicBoolean();
        QueryResult stored = cache.get(key, k -> {
            computed.set(true);
            QueryResult fresh = compute.get();
            log.debug("Cached result for key: {} ({} rows)", k, fresh.getRowCount());
            return fresh.deepCopy();
        });
        QueryResult copy = stored.deepCopy();
        copy.setCached(!computed.get());
        return copy;
    }

    /**
     * Invalidate every entry, e.g. after the store has been rebuilt.
     */
    public void invalidateAll() {
        long size = cache.estimatedSize();
        cache.invalidateAll();
        log.info("Invalidated query cache (~{} entries)", size);
    }

    public long size() {
        return cache.estimatedSize();
    }

    /**
     * Generate cache key from the canonical form of a parsed query.
     */
    public String generateCacheKey(Query query) {
        try {
            byte[] canonical = canonicalMapper.writeValueAsBytes(canonicalForm(query));
            return KEY_PREFIX + DigestUtils.md5DigestAsHex(canonical);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Query is not serializable: " + query, e);
        }
    }

    /**
     * Select, group-by and order-by keep their order since it shapes the output; filters
     * form a conjunction and are sorted.
     */
    static Map<String, Object> canonicalForm(Query query) {
        Map<String, Object> form = new LinkedHashMap<>();
        form.put("select", query.getSelect().stream()
                .map(QueryCacheService::canonicalSelect)
                .collect(Collectors.toList()));
        form.put("from", EventColumn.TABLE_NAME);
        form.put("where", query.getWhere().stream()
                .map(QueryCacheService::canonicalFilter)
                .sorted()
                .collect(Collectors.toList()));
        form.put("group_by", query.getGroupBy().stream()
                .map(EventColumn::columnName)
                .collect(Collectors.toList()));
        form.put("order_by", query.getOrderBy().stream()
                .map(QueryCacheService::canonicalOrder)
                .collect(Collectors.toList()));
        return form;
    }

    private static String canonicalSelect(SelectItem item) {
        if (item instanceof ColumnSelection) {
            return ((ColumnSelection) item).getColumn().columnName();
        }
        return ((AggregateSelection) item).outputName();
    }

    private static String canonicalFilter(Filter filter) {
        List<Object> values = filter.getValues();
        if (filter.getOperator() == FilterOperator.IN) {
            values = sortedDistinct(values);
        }
        return filter.getColumn().columnName() + "|" + filter.getOperator().wireName() + "|"
                + values.stream().map(String::valueOf).collect(Collectors.joining(","));
    }

    private static List<Object> sortedDistinct(List<Object> values) {
        List<Object> sorted = new ArrayList<>();
        for (Object value : values) {
            if (!sorted.contains(value)) {
                sorted.add(value);
            }
        }
        sorted.sort(ColumnType.VALUE_ORDER);
        return sorted;
    }

    private static String canonicalOrder(OrderSpec order) {
        return order.getOutputIndex() + (order.isDescending() ? ":desc" : ":asc");
    }
}

package com.eventquery.api;

import com.eventquery.domain.exception.InvalidQueryException;
import com.eventquery.domain.exception.QueryExecutionException;
import com.eventquery.domain.model.PlanDescription;
import com.eventquery.domain.model.QueryRequest;
import com.eventquery.domain.model.QueryResult;
import com.eventquery.domain.service.QueryService;
import com.eventquery.infrastructure.export.CsvResultWriter;
import com.eventquery.infrastructure.store.PartitionMetadata;
import com.eventquery.infrastructure.store.StoreException;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST API for event queries.
 *
 * Endpoints:
 * - POST /api/v1/analytics/query - Execute a query, JSON result
 * - POST /api/v1/analytics/query/csv - Execute a query, CSV result
 * - POST /api/v1/analytics/query/explain - Show the plan without executing
 * - GET /api/v1/analytics/partitions - List partition metadata
 * - DELETE /api/v1/analytics/cache - Drop all cached results
 * - GET /api/v1/analytics/health - Health check
 *
 * Invalid queries answer 400; store failures answer 500 with the store's message.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/analytics")
@RequiredArgsConstructor
public class QueryController {

    public static final MediaType TEXT_CSV = MediaType.parseMediaType("text/csv");

    private final QueryService queryService;
    private final CsvResultWriter csvResultWriter;

    /**
     * Execute a query.
     *
     * POST /api/v1/analytics/query
     *
     * Request body:
     * {
     *   "select": ["day", {"SUM": "bid_price"}],
     *   "from": "events",
     *   "where": [{"col": "type", "op": "eq", "val": "impression"}],
     *   "group_by": ["day"]
     * }
     *
     * Response:
     * - columns, rows
     * - planType: CATALOG_LOOKUP | PARTITION_SCAN | FULL_SCAN
     * - cached, partitionsScanned, rowsMatched, queryTimeMs
     */
    @PostMapping("/query")
    public ResponseEntity<QueryResult> query(@Valid @RequestBody QueryRequest request) {
        log.info("Query: select={}, where={}, groupBy={}", request.getSelect(), request.getWhere(), request.getGroupBy());
        return ResponseEntity.ok(queryService.execute(request));
    }

    @PostMapping(value = "/query/csv", produces = "text/csv")
    public ResponseEntity<String> queryCsv(@Valid @RequestBody QueryRequest request) {
        log.info("CSV query: select={}", request.getSelect());
        QueryResult result = queryService.execute(request);
        return ResponseEntity.ok()
                .contentType(TEXT_CSV)
                .body(csvResultWriter.toCsv(result));
    }

    @PostMapping("/query/explain")
    public ResponseEntity<PlanDescription> explain(@Valid @RequestBody QueryRequest request) {
        return ResponseEntity.ok(queryService.explain(request));
    }

    @GetMapping("/partitions")
    public ResponseEntity<List<PartitionMetadata>> partitions() {
        return ResponseEntity.ok(queryService.listPartitions());
    }

    @DeleteMapping("/cache")
    public ResponseEntity<Void> invalidateCache() {
        log.info("Cache invalidation requested");
        queryService.invalidateCache();
        return ResponseEntity.noContent().build();
    }

    /**
     * Health check endpoint.
     */
    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }

    @ExceptionHandler(InvalidQueryException.class)
    public ResponseEntity<Map<String, String>> handleInvalidQuery(InvalidQueryException e) {
        return error(HttpStatus.BAD_REQUEST, "invalid_query", e.getMessage());
    }

    @ExceptionHandler({MethodArgumentNotValidException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<Map<String, String>> handleMalformedRequest(Exception e) {
        return error(HttpStatus.BAD_REQUEST, "invalid_query", "Malformed query: " + e.getMessage());
    }

    @ExceptionHandler(StoreException.class)
    public ResponseEntity<Map<String, String>> handleStoreFailure(StoreException e) {
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "store_error", e.getMessage());
    }

    @ExceptionHandler(QueryExecutionException.class)
    public ResponseEntity<Map<String, String>> handleExecutionFailure(QueryExecutionException e) {
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "execution_error", e.getMessage());
    }

    private static ResponseEntity<Map<String, String>> error(HttpStatus status, String code, String message) {
        return ResponseEntity.status(status).body(Map.of("error", code, "message", String.valueOf(message)));
    }
}

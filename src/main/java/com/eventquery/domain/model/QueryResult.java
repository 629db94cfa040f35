package com.eventquery.domain.model;

import com.eventquery.domain.plan.PlanType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Materialized result of one query.
 *
 * {@code columns} is the rendered select list; each row holds one value per column in
 * the same order. {@code partitionsScanned} and {@code rowsMatched} tell an empty answer
 * apart from a query that never reached any data.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryResult {

    private List<String> columns;
    private List<List<Object>> rows;
    private PlanType planType;
    private boolean cached;
    private int partitionsScanned;
    private long rowsMatched;
    private long queryTimeMs;

    public int getRowCount() {
        return rows == null ? 0 : rows.size();
    }

    /**
     * Copy that shares no mutable list with this result. Row values themselves are
     * immutable (numbers, strings, java.time values).
     */
    public QueryResult deepCopy() {
        List<List<Object>> copiedRows = new ArrayList<>(rows.size());
        for (List<Object> row : rows) {
            copiedRows.add(new ArrayList<>(row));
        }
        return QueryResult.builder()
                .columns(new ArrayList<>(columns))
                .rows(copiedRows)
                .planType(planType)
                .cached(cached)
                .partitionsScanned(partitionsScanned)
                .rowsMatched(rowsMatched)
                .queryTimeMs(queryTimeMs)
                .build();
    }
}

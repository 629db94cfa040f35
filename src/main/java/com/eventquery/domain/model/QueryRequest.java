package com.eventquery.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Query as received from callers, before validation.
 *
 * Example:
 * <pre>
 * {
 *   "select": ["day", {"SUM": "bid_price"}],
 *   "from": "events",
 *   "where": [{"col": "type", "op": "eq", "val": "impression"}],
 *   "group_by": ["day"],
 *   "order_by": [{"col": "day", "dir": "asc"}]
 * }
 * </pre>
 * A {@code select} entry is either a column name or a single-key map from aggregate
 * function to column name ({@code *} only with COUNT).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class QueryRequest {

    @NotEmpty
    private List<Object> select;

    private String from;

    private List<FilterRequest> where;

    @JsonProperty("group_by")
    private List<String> groupBy;

    @JsonProperty("order_by")
    private List<OrderRequest> orderBy;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class FilterRequest {
        private String col;
        private String op;
        private Object val;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class OrderRequest {
        private String col;
        private String dir;
    }
}

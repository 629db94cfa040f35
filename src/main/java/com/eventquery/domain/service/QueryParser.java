package com.eventquery.domain.service;

import com.eventquery.domain.exception.InvalidQueryException;
import com.eventquery.domain.model.AggregateFunction;
import com.eventquery.domain.model.AggregateSelection;
import com.eventquery.domain.model.ColumnSelection;
import com.eventquery.domain.model.EventColumn;
import com.eventquery.domain.model.EventKind;
import com.eventquery.domain.model.Filter;
import com.eventquery.domain.model.FilterOperator;
import com.eventquery.domain.model.OrderSpec;
import com.eventquery.domain.model.Query;
import com.eventquery.domain.model.QueryRequest;
import com.eventquery.domain.model.SelectItem;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns a loosely typed {@link QueryRequest} into a validated {@link Query}.
 *
 * Rules:
 * - {@code from} must be {@code events} (or absent)
 * - COUNT is the only function accepting {@code *}; SUM and AVG need a numeric column
 * - every group-by column appears bare in select, and with a group-by every bare select
 *   column is grouped; without one, bare columns and aggregates cannot be mixed
 * - filter values are coerced to the column type
 * - order-by references a select output by bare name or rendered aggregate
 */
@Component
public class QueryParser {

    public Query parse(QueryRequest request) {
        if (request == null) {
            throw new InvalidQueryException("Query is empty");
        }
        if (request.getFrom() != null && !EventColumn.TABLE_NAME.equals(request.getFrom().trim())) {
            throw new InvalidQueryException("Unknown table '" + request.getFrom() + "', only '"
                    + EventColumn.TABLE_NAME + "' can be queried");
        }
        if (request.getSelect() == null || request.getSelect().isEmpty()) {
            throw new InvalidQueryException("select must list at least one column or aggregate");
        }

        Query.QueryBuilder builder = Query.builder();

        List<SelectItem> select = new ArrayList<>();
        for (Object entry : request.getSelect()) {
            select.add(parseSelectItem(entry));
        }
        Set<String> outputs = new LinkedHashSet<>();
        for (SelectItem item : select) {
            if (!outputs.add(item.outputName())) {
                throw new InvalidQueryException("Duplicate select output " + item.outputName());
            }
        }
        select.forEach(builder::select);

        List<EventColumn> groupBy = new ArrayList<>();
        if (request.getGroupBy() != null) {
            for (String name : request.getGroupBy()) {
                EventColumn column = column(name);
                if (groupBy.contains(column)) {
                    throw new InvalidQueryException("Duplicate group_by column " + column);
                }
                groupBy.add(column);
            }
        }
        validateGrouping(select, groupBy);
        groupBy.forEach(builder::groupBy);

        if (request.getWhere() != null) {
            for (QueryRequest.FilterRequest filter : request.getWhere()) {
                builder.where(parseFilter(filter));
            }
        }

        if (request.getOrderBy() != null) {
            for (QueryRequest.OrderRequest order : request.getOrderBy()) {
                builder.orderBy(parseOrder(order, select));
            }
        }

        return builder.build();
    }

    private SelectItem parseSelectItem(Object entry) {
        if (entry instanceof String) {
            return new ColumnSelection(column((String) entry));
        }
        if (entry instanceof Map) {
            Map<?, ?> map = (Map<?, ?>) entry;
            if (map.size() != 1) {
                throw new InvalidQueryException("Aggregate select entry must have exactly one function: " + entry);
            }
            Map.Entry<?, ?> only = map.entrySet().iterator().next();
            String functionName = String.valueOf(only.getKey());
            AggregateFunction function = AggregateFunction.find(functionName)
                    .orElseThrow(() -> new InvalidQueryException("Unsupported aggregate function " + functionName));
            if (!(only.getValue() instanceof String)) {
                throw new InvalidQueryException("Aggregate " + functionName + " needs a column name");
            }
            String target = ((String) only.getValue()).trim();
            if (AggregateSelection.ALL_ROWS.equals(target)) {
                if (function != AggregateFunction.COUNT) {
                    throw new InvalidQueryException(function + "(*) is not supported, only COUNT(*)");
                }
                return AggregateSelection.countAll();
            }
            EventColumn column = column(target);
            if (function != AggregateFunction.COUNT && !column.type().isNumeric()) {
                throw new InvalidQueryException(function + " requires a numeric column, '" + column + "' is not");
            }
            return new AggregateSelection(function, column);
        }
        throw new InvalidQueryException("Unsupported select entry: " + entry);
    }

    private static void validateGrouping(List<SelectItem> select, List<EventColumn> groupBy) {
        List<EventColumn> bare = new ArrayList<>();
        boolean hasAggregate = false;
        for (SelectItem item : select) {
            if (item instanceof ColumnSelection) {
                bare.add(((ColumnSelection) item).getColumn());
            } else {
                hasAggregate = true;
            }
        }
        if (groupBy.isEmpty()) {
            if (hasAggregate && !bare.isEmpty()) {
                throw new InvalidQueryException("Columns " + bare + " must appear in group_by when aggregates are selected");
            }
            return;
        }
        for (EventColumn column : groupBy) {
            if (!bare.contains(column)) {
                throw new InvalidQueryException("group_by column '" + column + "' must also appear in select");
            }
        }
        for (EventColumn column : bare) {
            if (!groupBy.contains(column)) {
                throw new InvalidQueryException("Selected column '" + column + "' must appear in group_by");
            }
        }
    }

    private Filter parseFilter(QueryRequest.FilterRequest request) {
        if (request == null) {
            throw new InvalidQueryException("where entries must be objects with col, op and val");
        }
        EventColumn column = column(request.getCol());
        FilterOperator operator = FilterOperator.find(request.getOp())
                .orElseThrow(() -> new InvalidQueryException("Unsupported operator '" + request.getOp()
                        + "' on " + column + ", expected eq, neq, in or between"));
        Object raw = request.getVal();

        List<Object> values = new ArrayList<>();
        switch (operator) {
            case EQ:
            case NEQ:
                if (raw == null || raw instanceof Collection || raw instanceof Map) {
                    throw new InvalidQueryException(operator.wireName() + " on " + column + " needs a single value");
                }
                values.add(coerce(column, raw));
                break;
            case IN:
                if (!(raw instanceof Collection) || ((Collection<?>) raw).isEmpty()) {
                    throw new InvalidQueryException("in on " + column + " needs a non-empty list");
                }
                for (Object value : (Collection<?>) raw) {
                    Object coerced = coerce(column, value);
                    if (!values.contains(coerced)) {
                        values.add(coerced);
                    }
                }
                break;
            case BETWEEN:
                if (!(raw instanceof List) || ((List<?>) raw).size() != 2) {
                    throw new InvalidQueryException("between on " + column + " needs a [low, high] list");
                }
                values.add(coerce(column, ((List<?>) raw).get(0)));
                values.add(coerce(column, ((List<?>) raw).get(1)));
                break;
            default:
                throw new IllegalStateException("Unhandled operator " + operator);
        }
        return new Filter(column, operator, values);
    }

    private static Object coerce(EventColumn column, Object raw) {
        if (raw == null) {
            throw new InvalidQueryException("Filter on " + column + " has a null value");
        }
        if (column == EventColumn.TYPE) {
            return EventKind.find(String.valueOf(raw))
                    .map(EventKind::wireName)
                    .orElseThrow(() -> new InvalidQueryException("Unknown event type '" + raw + "'"));
        }
        try {
            return column.type().coerce(raw);
        } catch (IllegalArgumentException e) {
            throw new InvalidQueryException("Invalid value for " + column + ": " + e.getMessage(), e);
        }
    }

    private static OrderSpec parseOrder(QueryRequest.OrderRequest order, List<SelectItem> select) {
        if (order == null || order.getCol() == null) {
            throw new InvalidQueryException("order_by entries need a col");
        }
        String reference = order.getCol().replace(" ", "");
        int index = -1;
        for (int i = 0; i < select.size(); i++) {
            if (select.get(i).outputName().equalsIgnoreCase(reference)) {
                index = i;
                break;
            }
        }
        if (index < 0) {
            throw new InvalidQueryException("order_by column '" + order.getCol() + "' is not a select output");
        }
        String direction = order.getDir() == null ? "asc" : order.getDir().trim().toLowerCase();
        if (!direction.equals("asc") && !direction.equals("desc")) {
            throw new InvalidQueryException("order_by direction must be asc or desc, got '" + order.getDir() + "'");
        }
        return new OrderSpec(index, direction.equals("desc"));
    }

    private static EventColumn column(String name) {
        return EventColumn.find(name)
                .orElseThrow(() -> new InvalidQueryException("Unknown column '" + name + "'"));
    }
}

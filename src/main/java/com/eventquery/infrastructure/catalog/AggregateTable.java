package com.eventquery.infrastructure.catalog;

import lombok.Value;

import java.util.List;

@Value
public class AggregateTable {

    AggregateTableDefinition definition;
    List<AggregateRow> rows;

    public AggregateTable(AggregateTableDefinition definition, List<AggregateRow> rows) {
        this.definition = definition;
        this.rows = List.copyOf(rows);
    }
}

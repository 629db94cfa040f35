package com.eventquery.domain.model;

import lombok.Value;

@Value
public class ColumnSelection implements SelectItem {

    EventColumn column;

    @Override
    public String outputName() {
        return column.columnName();
    }

    @Override
    public boolean isAggregate() {
        return false;
    }
}

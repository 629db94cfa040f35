package com.eventquery.infrastructure.catalog;

import com.eventquery.domain.model.AggregateFunction;
import com.eventquery.domain.model.AggregateSelection;
import com.eventquery.domain.model.EventColumn;
import com.eventquery.domain.model.EventKind;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Declares one precomputed table: which events it summarizes, its key columns and the
 * column whose (sum, count) state it keeps.
 *
 * A table over a value column answers SUM, COUNT and AVG of that column; a table with
 * no value column counts rows and answers only {@code COUNT(*)}.
 */
@Value
public class AggregateTableDefinition {

    String name;
    EventKind kindFilter;
    List<EventColumn> keyColumns;
    EventColumn valueColumn;

    public AggregateTableDefinition(String name, EventKind kindFilter, List<EventColumn> keyColumns, EventColumn valueColumn) {
        if (valueColumn != null && !valueColumn.type().isNumeric()) {
            throw new IllegalArgumentException("Value column of " + name + " must be numeric");
        }
        this.name = name;
        this.kindFilter = kindFilter;
        this.keyColumns = List.copyOf(keyColumns);
        this.valueColumn = valueColumn;
    }

    public boolean countsRows() {
        return valueColumn == null;
    }

    public boolean supports(AggregateSelection aggregate) {
        if (countsRows()) {
            return aggregate.isCountAll();
        }
        return !aggregate.isCountAll() && aggregate.getColumn() == valueColumn;
    }

    public List<AggregateSignature> signatures() {
        List<AggregateSignature> signatures = new ArrayList<>();
        if (countsRows()) {
            signatures.add(AggregateSignature.of(kindFilter, keyColumns, AggregateSelection.countAll()));
        } else {
            for (AggregateFunction function : AggregateFunction.values()) {
                signatures.add(AggregateSignature.of(kindFilter, keyColumns, new AggregateSelection(function, valueColumn)));
            }
        }
        return signatures;
    }

    public int keyIndex(EventColumn column) {
        return keyColumns.indexOf(column);
    }
}

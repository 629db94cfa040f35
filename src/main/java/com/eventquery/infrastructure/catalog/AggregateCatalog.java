package com.eventquery.infrastructure.catalog;

import com.eventquery.domain.model.AggregateSelection;
import com.eventquery.domain.model.EventKind;

import java.util.List;
import java.util.Optional;

/**
 * Registry and storage of precomputed grouped aggregates.
 */
public interface AggregateCatalog {

    List<AggregateTableDefinition> definitions();

    /** Table whose signature equals {@code signature} exactly. */
    Optional<AggregateTableDefinition> lookup(AggregateSignature signature);

    /**
     * Tables with the given implicit kind filter that can produce {@code aggregate},
     * whatever their key columns, in registration order.
     */
    List<AggregateTableDefinition> candidates(EventKind kindFilter, AggregateSelection aggregate);

    /** Whether the table has been built and can be loaded. */
    boolean isMaterialized(AggregateTableDefinition definition);

    AggregateTable load(AggregateTableDefinition definition);

    void write(AggregateTable table);

    /** Forget loaded tables so that rewritten files are read again. */
    void refresh();
}

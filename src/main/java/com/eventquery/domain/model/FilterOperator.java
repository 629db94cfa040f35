package com.eventquery.domain.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Operators allowed in a {@code where} entry. Entries are always combined with AND.
 */
public enum FilterOperator {
    EQ("eq"),
    NEQ("neq"),
    IN("in"),
    BETWEEN("between");

    private final String wireName;

    FilterOperator(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<FilterOperator> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(operator -> operator.wireName.equalsIgnoreCase(name.trim()))
                .findFirst();
    }
}

package com.eventquery.domain.model;

import java.util.Arrays;
import java.util.Optional;

public enum AggregateFunction {
    SUM,
    COUNT,
    AVG;

    public static Optional<AggregateFunction> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(function -> function.name().equalsIgnoreCase(name.trim()))
                .findFirst();
    }
}

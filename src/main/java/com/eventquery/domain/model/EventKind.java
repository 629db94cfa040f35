package com.eventquery.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Kind of an ad-serving event. Every partition holds events of exactly one kind.
 */
public enum EventKind {
    SERVE("serve"),
    IMPRESSION("impression"),
    CLICK("click"),
    PURCHASE("purchase");

    private final String wireName;

    EventKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public static Optional<EventKind> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(kind -> kind.wireName.equalsIgnoreCase(name.trim()))
                .findFirst();
    }

    @JsonCreator
    public static EventKind fromWireName(String name) {
        return find(name).orElseThrow(() -> new IllegalArgumentException("Unknown event kind: " + name));
    }

    @Override
    public String toString() {
        return wireName;
    }
}

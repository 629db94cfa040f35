package com.eventquery.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Comparator;

/**
 * Physical value type of an event column.
 *
 * Values flowing through the engine are always one of: {@link Long}, {@link Double},
 * {@link String}, {@link LocalDate}, {@link LocalDateTime}.
 */
public enum ColumnType {
    LONG,
    DOUBLE,
    STRING,
    DATE,
    DATETIME;

    private static final DateTimeFormatter SPACED_DATETIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm[:ss]");

    /** Natural order of non-null engine values of one type. */
    public static final Comparator<Object> VALUE_ORDER = ColumnType::compareValues;

    /**
     * Compare two non-null values of the same column type.
     *
     * @throws ClassCastException if the values are of different types
     */
    @SuppressWarnings("unchecked")
    public static int compareValues(Object left, Object right) {
        return ((Comparable<Object>) left).compareTo(right);
    }

    public boolean isNumeric() {
        return this == LONG || this == DOUBLE;
    }

    /**
     * Convert a loosely typed value (JSON scalar, CSV cell) to this type.
     *
     * @throws IllegalArgumentException if the value cannot represent this type
     */
    public Object coerce(Object raw) {
        if (raw == null) {
            return null;
        }
        switch (this) {
            case LONG:
                return toLong(raw);
            case DOUBLE:
                return toDouble(raw);
            case STRING:
                if (raw instanceof String || raw instanceof Number || raw instanceof Boolean) {
                    return raw.toString();
                }
                throw new IllegalArgumentException("Expected text but got " + raw);
            case DATE:
                if (raw instanceof LocalDate) {
                    return raw;
                }
                return parseDate(raw.toString());
            case DATETIME:
                if (raw instanceof LocalDateTime) {
                    return raw;
                }
                return parseDateTime(raw.toString());
            default:
                throw new IllegalStateException("Unhandled column type " + this);
        }
    }

    private static Long toLong(Object raw) {
        if (raw instanceof Long) {
            return (Long) raw;
        }
        if (raw instanceof Integer || raw instanceof Short || raw instanceof Byte) {
            return ((Number) raw).longValue();
        }
        try {
            return new BigDecimal(raw.toString().trim()).longValueExact();
        } catch (ArithmeticException | NumberFormatException e) {
            throw new IllegalArgumentException("Expected an integer but got " + raw, e);
        }
    }

    private static Double toDouble(Object raw) {
        if (raw instanceof Double) {
            return (Double) raw;
        }
        if (raw instanceof Number) {
            return ((Number) raw).doubleValue();
        }
        try {
            return Double.valueOf(raw.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Expected a number but got " + raw, e);
        }
    }

    private static LocalDate parseDate(String text) {
        try {
            return LocalDate.parse(text.trim());
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Expected a date (yyyy-MM-dd) but got " + text, e);
        }
    }

    private static LocalDateTime parseDateTime(String text) {
        String trimmed = text.trim();
        try {
            if (trimmed.indexOf('T') > 0) {
                return LocalDateTime.parse(trimmed);
            }
            return LocalDateTime.parse(trimmed, SPACED_DATETIME);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Expected a timestamp (yyyy-MM-dd HH:mm:ss) but got " + text, e);
        }
    }
}

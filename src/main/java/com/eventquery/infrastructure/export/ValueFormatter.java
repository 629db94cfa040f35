package com.eventquery.infrastructure.export;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Stable textual form of result values: ISO dates, {@code yyyy-MM-dd HH:mm:ss} hours,
 * numbers through {@code toString} (full precision, no locale), empty for null.
 */
public final class ValueFormatter {

    public static final DateTimeFormatter DATE_TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private ValueFormatter() {
    }

    public static String format(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof LocalDateTime) {
            return ((LocalDateTime) value).format(DATE_TIME_FORMAT);
        }
        if (value instanceof BigDecimal) {
            return ((BigDecimal) value).toPlainString();
        }
        return value.toString();
    }
}

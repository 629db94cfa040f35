package com.eventquery.domain.model;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;

/**
 * The single definition of the temporal keys derived from an event timestamp.
 *
 * Used when partitions are written, when a partition lacks a stored derived column,
 * and when partition metadata is compared against temporal filters. All keys are in UTC.
 */
public final class DerivedColumns {

    public static final DateTimeFormatter MINUTE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    private DerivedColumns() {
    }

    public static LocalDate day(long tsMillis) {
        return toDateTime(tsMillis).toLocalDate();
    }

    /** Monday of the ISO week containing the timestamp. */
    public static LocalDate week(long tsMillis) {
        return weekOf(day(tsMillis));
    }

    public static LocalDate weekOf(LocalDate day) {
        return day.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
    }

    public static LocalDateTime hour(long tsMillis) {
        return toDateTime(tsMillis).truncatedTo(ChronoUnit.HOURS);
    }

    public static String minute(long tsMillis) {
        return toDateTime(tsMillis).format(MINUTE_FORMAT);
    }

    /**
     * Value of a derived column for the given timestamp.
     *
     * @throws IllegalArgumentException if the column is not derived from {@code ts}
     */
    public static Object derive(EventColumn column, long tsMillis) {
        switch (column) {
            case DAY:
                return day(tsMillis);
            case WEEK:
                return week(tsMillis);
            case HOUR:
                return hour(tsMillis);
            case MINUTE:
                return minute(tsMillis);
            default:
                throw new IllegalArgumentException(column + " is not derived from ts");
        }
    }

    private static LocalDateTime toDateTime(long tsMillis) {
        return LocalDateTime.ofInstant(Instant.ofEpochMilli(tsMillis), ZoneOffset.UTC);
    }
}

package com.eventquery.domain.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Columns of the logical {@code events} table.
 *
 * The last four columns are derived from {@code ts} by {@link DerivedColumns}.
 */
public enum EventColumn {
    TS("ts", ColumnType.LONG, false),
    TYPE("type", ColumnType.STRING, false),
    AUCTION_ID("auction_id", ColumnType.STRING, false),
    ADVERTISER_ID("advertiser_id", ColumnType.LONG, false),
    PUBLISHER_ID("publisher_id", ColumnType.LONG, false),
    BID_PRICE("bid_price", ColumnType.DOUBLE, false),
    USER_ID("user_id", ColumnType.LONG, false),
    TOTAL_PRICE("total_price", ColumnType.DOUBLE, false),
    COUNTRY("country", ColumnType.STRING, false),
    DAY("day", ColumnType.DATE, true),
    WEEK("week", ColumnType.DATE, true),
    HOUR("hour", ColumnType.DATETIME, true),
    MINUTE("minute", ColumnType.STRING, true);

    public static final String TABLE_NAME = "events";

    private final String columnName;
    private final ColumnType type;
    private final boolean derived;

    EventColumn(String columnName, ColumnType type, boolean derived) {
        this.columnName = columnName;
        this.type = type;
        this.derived = derived;
    }

    public String columnName() {
        return columnName;
    }

    public ColumnType type() {
        return type;
    }

    public boolean isDerived() {
        return derived;
    }

    /**
     * Columns whose value is constant within a partition, so filters on them are
     * answered by partition selection alone.
     */
    public boolean isPartitionKey() {
        return this == TYPE || this == DAY || this == WEEK;
    }

    /**
     * Columns that narrow the candidate partitions: the partition keys plus the
     * time columns checked against each partition's [tsMin, tsMax] span.
     */
    public boolean isPruningColumn() {
        return isPartitionKey() || this == TS || this == HOUR || this == MINUTE;
    }

    public static Optional<EventColumn> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(column -> column.columnName.equals(name.trim()))
                .findFirst();
    }

    @Override
    public String toString() {
        return columnName;
    }
}

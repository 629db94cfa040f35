package com.eventquery.infrastructure.store;

import com.eventquery.domain.model.EventColumn;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;

import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Streams one column file (a JSON array) into a typed value array without building a
 * tree of the whole file.
 */
final class ColumnFileReader {

    private ColumnFileReader() {
    }

    static Object[] read(JsonFactory jsonFactory, Path file, EventColumn column, int expectedRows) throws IOException {
        Object[] values = new Object[expectedRows];
        try (JsonParser parser = jsonFactory.createParser(file.toFile())) {
            if (parser.nextToken() != JsonToken.START_ARRAY) {
                throw new StoreException("Column file " + file + " is not a JSON array");
            }
            int index = 0;
            JsonToken token;
            while ((token = parser.nextToken()) != JsonToken.END_ARRAY) {
                if (token == null) {
                    throw new StoreException("Column file " + file + " is truncated");
                }
                if (index >= expectedRows) {
                    throw new StoreException("Column file " + file + " holds more than " + expectedRows + " rows");
                }
                values[index++] = token == JsonToken.VALUE_NULL ? null : readValue(parser, column);
            }
            if (index != expectedRows) {
                throw new StoreException("Column file " + file + " holds " + index + " rows, expected " + expectedRows);
            }
        }
        return values;
    }

    private static Object readValue(JsonParser parser, EventColumn column) throws IOException {
        switch (column.type()) {
            case LONG:
                return parser.getLongValue();
            case DOUBLE:
                return parser.getDoubleValue();
            case STRING:
                return parser.getText();
            case DATE:
                return LocalDate.parse(parser.getText());
            case DATETIME:
                return LocalDateTime.parse(parser.getText());
            default:
                throw new IllegalStateException("Unhandled column type " + column.type());
        }
    }
}

package com.eventquery.infrastructure.catalog;

import com.eventquery.domain.model.AggregateFunction;
import com.eventquery.domain.model.AggregateSelection;
import com.eventquery.domain.model.EventColumn;
import com.eventquery.domain.model.EventKind;
import com.eventquery.infrastructure.store.StoreException;
import com.eventquery.infrastructure.store.StoreLayout;
import com.fasterxml.jackson.core.JsonEncoding;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Aggregate catalog reading and writing {@code aggregates/<table>.json} under the store
 * root.
 *
 * File format:
 * <pre>
 * {"name": "daily_revenue", "keyColumns": ["day"], "valueColumn": "bid_price",
 *  "rows": [{"key": ["2024-01-01"], "sum": "6.0", "count": 3}]}
 * </pre>
 * Sums are written as decimal strings so they survive the round trip exactly.
 * Loaded tables are kept in memory until {@link #refresh()}.
 */
@Slf4j
public class FileSystemAggregateCatalog implements AggregateCatalog {

    private final Path root;
    private final ObjectMapper objectMapper;
    private final List<AggregateTableDefinition> definitions;
    private final Map<AggregateSignature, AggregateTableDefinition> bySignature = new HashMap<>();
    private final Map<MeasureKey, List<AggregateTableDefinition>> byMeasure = new HashMap<>();
    private final Map<String, AggregateTable> loaded = new ConcurrentHashMap<>();

    public FileSystemAggregateCatalog(Path root, ObjectMapper objectMapper, List<AggregateTableDefinition> definitions) {
        this.root = root;
        this.objectMapper = objectMapper;
        this.definitions = List.copyOf(definitions);
        for (AggregateTableDefinition definition : this.definitions) {
            for (AggregateSignature signature : definition.signatures()) {
                AggregateTableDefinition previous = bySignature.putIfAbsent(signature, definition);
                if (previous != null) {
                    throw new IllegalArgumentException("Tables " + previous.getName() + " and "
                            + definition.getName() + " share signature " + signature);
                }
                byMeasure.computeIfAbsent(new MeasureKey(signature), key -> new ArrayList<>()).add(definition);
            }
        }
    }

    @Override
    public List<AggregateTableDefinition> definitions() {
        return definitions;
    }

    @Override
    public Optional<AggregateTableDefinition> lookup(AggregateSignature signature) {
        return Optional.ofNullable(bySignature.get(signature));
    }

    @Override
    public List<AggregateTableDefinition> candidates(EventKind kindFilter, AggregateSelection aggregate) {
        return byMeasure.getOrDefault(new MeasureKey(kindFilter, aggregate), List.of());
    }

    @Override
    public boolean isMaterialized(AggregateTableDefinition definition) {
        return loaded.containsKey(definition.getName()) || Files.exists(tableFile(definition));
    }

    @Override
    public AggregateTable load(AggregateTableDefinition definition) {
        return loaded.computeIfAbsent(definition.getName(), name -> read(definition));
    }

    @Override
    public void write(AggregateTable table) {
        AggregateTableDefinition definition = table.getDefinition();
        Path target = tableFile(definition);
        Path staging = target.resolveSibling(target.getFileName() + ".tmp");
        try {
            Files.createDirectories(target.getParent());
            try (JsonGenerator generator = objectMapper.getFactory().createGenerator(staging.toFile(), JsonEncoding.UTF8)) {
                generator.writeStartObject();
                generator.writeStringField("name", definition.getName());
                if (definition.getKindFilter() != null) {
                    generator.writeStringField("kindFilter", definition.getKindFilter().wireName());
                }
                generator.writeArrayFieldStart("keyColumns");
                for (EventColumn column : definition.getKeyColumns()) {
                    generator.writeString(column.columnName());
                }
                generator.writeEndArray();
                generator.writeStringField("valueColumn",
                        definition.countsRows() ? AggregateSelection.ALL_ROWS : definition.getValueColumn().columnName());
                generator.writeArrayFieldStart("rows");
                for (AggregateRow row : table.getRows()) {
                    generator.writeStartObject();
                    generator.writeArrayFieldStart("key");
                    for (Object value : row.getKey()) {
                        writeKeyValue(generator, value);
                    }
                    generator.writeEndArray();
                    generator.writeStringField("sum", row.getSum().toPlainString());
                    generator.writeNumberField("count", row.getCount());
                    generator.writeEndObject();
                }
                generator.writeEndArray();
                generator.writeEndObject();
            }
            Files.move(staging, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new StoreException("Failed to write aggregate table " + definition.getName(), e);
        }
        loaded.remove(definition.getName());
        log.info("Wrote aggregate table {} ({} rows)", definition.getName(), table.getRows().size());
    }

    @Override
    public void refresh() {
        loaded.clear();
    }

    private AggregateTable read(AggregateTableDefinition definition) {
        Path file = tableFile(definition);
        if (!Files.exists(file)) {
            throw new StoreException("Aggregate table " + definition.getName() + " has not been built");
        }
        try {
            JsonNode tree = objectMapper.readTree(file.toFile());
            List<EventColumn> storedKeys = new ArrayList<>();
            for (JsonNode column : tree.path("keyColumns")) {
                storedKeys.add(EventColumn.find(column.asText())
                        .orElseThrow(() -> new StoreException("Unknown key column " + column + " in " + file)));
            }
            if (!storedKeys.equals(definition.getKeyColumns())) {
                throw new StoreException("Aggregate table " + file + " is keyed by " + storedKeys
                        + " but registered with " + definition.getKeyColumns());
            }

            List<AggregateRow> rows = new ArrayList<>();
            for (JsonNode rowNode : tree.path("rows")) {
                List<Object> key = new ArrayList<>(storedKeys.size());
                int index = 0;
                for (JsonNode valueNode : rowNode.path("key")) {
                    key.add(readKeyValue(storedKeys.get(index++), valueNode));
                }
                rows.add(new AggregateRow(key, new BigDecimal(rowNode.path("sum").asText("0")), rowNode.path("count").asLong()));
            }
            log.debug("Loaded aggregate table {} ({} rows)", definition.getName(), rows.size());
            return new AggregateTable(definition, rows);
        } catch (IOException | IllegalArgumentException e) {
            throw new StoreException("Unreadable aggregate table " + file, e);
        }
    }

    private Path tableFile(AggregateTableDefinition definition) {
        return StoreLayout.aggregatesRoot(root).resolve(definition.getName() + ".json");
    }

    private static Object readKeyValue(EventColumn column, JsonNode node) {
        if (node.isNull()) {
            return null;
        }
        return column.type().coerce(node.isNumber() ? node.numberValue() : node.asText());
    }

    private static void writeKeyValue(JsonGenerator generator, Object value) throws IOException {
        if (value == null) {
            generator.writeNull();
        } else if (value instanceof Long) {
            generator.writeNumber((Long) value);
        } else if (value instanceof Double) {
            generator.writeNumber((Double) value);
        } else {
            generator.writeString(value.toString());
        }
    }

    @Value
    private static class MeasureKey {

        EventKind kindFilter;
        AggregateFunction function;
        EventColumn column;

        MeasureKey(AggregateSignature signature) {
            this(signature.getKindFilter(), signature.getFunction(), signature.getColumn());
        }

        MeasureKey(EventKind kindFilter, AggregateSelection aggregate) {
            this(kindFilter, aggregate.getFunction(), aggregate.getColumn());
        }

        MeasureKey(EventKind kindFilter, AggregateFunction function, EventColumn column) {
            this.kindFilter = kindFilter;
            this.function = function;
            this.column = column;
        }
    }
}

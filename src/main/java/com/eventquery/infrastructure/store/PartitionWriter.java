package com.eventquery.infrastructure.store;

import com.eventquery.domain.model.EventColumn;
import com.eventquery.domain.model.EventKind;
import com.eventquery.domain.model.EventRecord;
import com.fasterxml.jackson.core.JsonEncoding;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Writes one immutable partition: a metadata file plus one JSON array per column.
 *
 * Rows are sorted by {@code ts} before writing. The partition directory is assembled
 * under a temporary name and moved into place, so readers never observe a half-written
 * partition.
 */
@Slf4j
public class PartitionWriter {

    private final Path root;
    private final ObjectMapper objectMapper;

    public PartitionWriter(Path root, ObjectMapper objectMapper) {
        this.root = root;
        this.objectMapper = objectMapper.copy()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public PartitionMetadata write(EventKind kind, LocalDate day, List<EventRecord> events) {
        return write(kind, day, events, Arrays.asList(EventColumn.values()));
    }

    /**
     * Write a partition holding only the given columns. Derived columns left out are
     * recomputed from {@code ts} when read.
     */
    public PartitionMetadata write(EventKind kind, LocalDate day, List<EventRecord> events, List<EventColumn> columns) {
        PartitionRef ref = new PartitionRef(kind, day);
        List<EventRecord> sorted = new ArrayList<>(events);
        sorted.sort(Comparator.comparingLong(EventRecord::getTs));
        for (EventRecord event : sorted) {
            if (event.getType() != kind || !event.value(EventColumn.DAY).equals(day)) {
                throw new IllegalArgumentException("Event " + event + " does not belong to partition " + ref);
            }
        }

        PartitionMetadata metadata = PartitionMetadata.builder()
                .kind(kind)
                .day(day)
                .rowCount(sorted.size())
                .tsMin(sorted.isEmpty() ? null : sorted.get(0).getTs())
                .tsMax(sorted.isEmpty() ? null : sorted.get(sorted.size() - 1).getTs())
                .columns(columns.stream().map(EventColumn::columnName).collect(Collectors.toList()))
                .build();

        Path target = StoreLayout.partitionDir(root, ref);
        if (Files.exists(target)) {
            throw new StoreException("Partition " + ref + " already exists; partitions are immutable");
        }
        Path staging = target.resolveSibling(target.getFileName() + ".tmp-" + System.nanoTime());
        try {
            Files.createDirectories(staging);
            for (EventColumn column : columns) {
                writeColumn(StoreLayout.columnFile(staging, column), column, sorted);
            }
            objectMapper.writeValue(staging.resolve(StoreLayout.METADATA_FILE).toFile(), metadata);
            Files.move(staging, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new StoreException("Failed to write partition " + ref, e);
        }

        log.debug("Wrote partition {} ({} rows, {} columns)", ref, sorted.size(), columns.size());
        return metadata;
    }

    private void writeColumn(Path file, EventColumn column, List<EventRecord> events) throws IOException {
        try (JsonGenerator generator = objectMapper.getFactory().createGenerator(file.toFile(), JsonEncoding.UTF8)) {
            generator.writeStartArray();
            for (EventRecord event : events) {
                writeValue(generator, event.value(column));
            }
            generator.writeEndArray();
        }
    }

    private static void writeValue(JsonGenerator generator, Object value) throws IOException {
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
}

package com.eventquery.infrastructure.store;

import com.eventquery.domain.model.DerivedColumns;
import com.eventquery.domain.model.EventColumn;
import com.eventquery.domain.model.EventKind;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.NavigableMap;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Partition store backed by the directory layout described in {@link StoreLayout}.
 *
 * Partition metadata is read once and kept in memory; the store is append-only, so it
 * only changes through {@link #refresh()} after new partitions are written. Scans read
 * the projected column files of one partition, nothing else.
 */
@Slf4j
public class FileSystemPartitionStore implements PartitionStore {

    private final Path root;
    private final ObjectMapper objectMapper;

    private volatile NavigableMap<PartitionRef, PartitionMetadata> partitions;

    public FileSystemPartitionStore(Path root, ObjectMapper objectMapper) {
        this.root = root;
        this.objectMapper = objectMapper.copy()
                .registerModule(new JavaTimeModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Override
    public List<PartitionMetadata> listPartitions(Set<EventKind> kinds, LocalDate fromDay, LocalDate toDay) {
        return metadata().values().stream()
                .filter(partition -> kinds == null || kinds.contains(partition.getKind()))
                .filter(partition -> fromDay == null || !partition.getDay().isBefore(fromDay))
                .filter(partition -> toDay == null || !partition.getDay().isAfter(toDay))
                .collect(Collectors.toList());
    }

    @Override
    public long scan(PartitionRef partition, List<EventColumn> columns,
                     Predicate<ProjectedRow> filter, Consumer<ProjectedRow> sink) {
        PartitionMetadata metadata = metadata().get(partition);
        Path dir = StoreLayout.partitionDir(root, partition);
        if (metadata == null || !Files.isDirectory(dir)) {
            throw new PartitionNotFoundException(partition);
        }

        int rowCount = Math.toIntExact(metadata.getRowCount());
        Object[][] data = new Object[columns.size()][];
        Object[] timestamps = null;
        for (int i = 0; i < columns.size(); i++) {
            EventColumn column = columns.get(i);
            Path file = StoreLayout.columnFile(dir, column);
            if (Files.exists(file)) {
                data[i] = readColumn(partition, file, column, rowCount);
            } else if (column.isDerived()) {
                if (timestamps == null) {
                    timestamps = readTimestamps(partition, dir, rowCount);
                }
                data[i] = derive(column, timestamps);
            } else if (column == EventColumn.TYPE) {
                Object[] kinds = new Object[rowCount];
                Arrays.fill(kinds, partition.getKind().wireName());
                data[i] = kinds;
            } else {
                throw new ColumnNotAvailableException(partition, column);
            }
        }

        ColumnarRow row = new ColumnarRow(data);
        long passed = 0;
        for (int index = 0; index < rowCount; index++) {
            row.position = index;
            if (filter.test(row)) {
                sink.accept(row);
                passed++;
            }
        }
        return passed;
    }

    @Override
    public synchronized void refresh() {
        partitions = null;
    }

    private Object[] readTimestamps(PartitionRef partition, Path dir, int rowCount) {
        Path file = StoreLayout.columnFile(dir, EventColumn.TS);
        if (!Files.exists(file)) {
            throw new ColumnNotAvailableException(partition, EventColumn.TS);
        }
        return readColumn(partition, file, EventColumn.TS, rowCount);
    }

    private Object[] readColumn(PartitionRef partition, Path file, EventColumn column, int rowCount) {
        try {
            return ColumnFileReader.read(objectMapper.getFactory(), file, column, rowCount);
        } catch (IOException e) {
            if (!Files.exists(file)) {
                throw new PartitionNotFoundException(partition, e);
            }
            throw new StoreException("Failed to read column " + column + " of partition " + partition, e);
        }
    }

    private static Object[] derive(EventColumn column, Object[] timestamps) {
        Object[] values = new Object[timestamps.length];
        for (int i = 0; i < timestamps.length; i++) {
            values[i] = timestamps[i] == null ? null : DerivedColumns.derive(column, (Long) timestamps[i]);
        }
        return values;
    }

    private NavigableMap<PartitionRef, PartitionMetadata> metadata() {
        NavigableMap<PartitionRef, PartitionMetadata> loaded = partitions;
        if (loaded == null) {
            synchronized (this) {
                loaded = partitions;
                if (loaded == null) {
                    loaded = Collections.unmodifiableNavigableMap(loadMetadata());
                    partitions = loaded;
                }
            }
        }
        return loaded;
    }

    private NavigableMap<PartitionRef, PartitionMetadata> loadMetadata() {
        NavigableMap<PartitionRef, PartitionMetadata> loaded = new TreeMap<>();
        Path partitionedRoot = StoreLayout.partitionedRoot(root);
        if (!Files.isDirectory(partitionedRoot)) {
            log.warn("No partitioned data under {}", partitionedRoot);
            return loaded;
        }
        for (Path kindDir : listDirectories(partitionedRoot, StoreLayout.TYPE_PREFIX)) {
            for (Path dayDir : listDirectories(kindDir, StoreLayout.DAY_PREFIX)) {
                Path metadataFile = dayDir.resolve(StoreLayout.METADATA_FILE);
                if (!Files.exists(metadataFile)) {
                    log.warn("Skipping {}: no {}", dayDir, StoreLayout.METADATA_FILE);
                    continue;
                }
                try {
                    PartitionMetadata metadata = objectMapper.readValue(metadataFile.toFile(), PartitionMetadata.class);
                    loaded.put(metadata.ref(), metadata);
                } catch (IOException e) {
                    throw new StoreException("Unreadable partition metadata " + metadataFile, e);
                }
            }
        }
        log.info("Loaded metadata for {} partitions from {}", loaded.size(), partitionedRoot);
        return loaded;
    }

    private static List<Path> listDirectories(Path parent, String prefix) {
        try (Stream<Path> children = Files.list(parent)) {
            return children
                    .filter(Files::isDirectory)
                    .filter(path -> {
                        String name = path.getFileName().toString();
                        return name.startsWith(prefix) && !name.contains(".tmp-");
                    })
                    .sorted()
                    .collect(Collectors.toCollection(ArrayList::new));
        } catch (IOException e) {
            throw new StoreException("Failed to list " + parent, e);
        }
    }

    private static final class ColumnarRow implements ProjectedRow {

        private final Object[][] data;
        private int position;

        private ColumnarRow(Object[][] data) {
            this.data = data;
        }

        @Override
        public Object get(int columnIndex) {
            return data[columnIndex][position];
        }
    }
}

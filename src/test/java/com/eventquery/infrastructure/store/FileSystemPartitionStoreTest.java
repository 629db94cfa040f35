package com.eventquery.infrastructure.store;

import com.eventquery.domain.model.EventColumn;
import com.eventquery.domain.model.EventKind;
import com.eventquery.domain.model.EventRecord;
import com.eventquery.support.TestDataSets;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static com.eventquery.support.TestDataSets.DAY1;
import static com.eventquery.support.TestDataSets.DAY2;
import static com.eventquery.support.TestDataSets.DAY3;
import static com.eventquery.support.TestDataSets.impression;
import static com.eventquery.support.TestDataSets.ts;
import static org.junit.jupiter.api.Assertions.*;

class FileSystemPartitionStoreTest {

    @TempDir
    Path root;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private PartitionWriter writer;
    private FileSystemPartitionStore store;

    @BeforeEach
    void setUp() {
        writer = new PartitionWriter(root, objectMapper);
        store = new FileSystemPartitionStore(root, objectMapper);
    }

    @Test
    void testListPartitions_CanonicalOrderAndMetadata() {
        // Given
        TestDataSets.writeAll(writer, TestDataSets.dailyRevenueEvents());

        // When
        List<PartitionMetadata> partitions = store.listPartitions();

        // Then
        List<String> refs = partitions.stream().map(p -> p.ref().toString()).collect(Collectors.toList());
        assertEquals(List.of(
                "type=click/day=2024-01-01",
                "type=impression/day=2024-01-01",
                "type=purchase/day=2024-01-01",
                "type=click/day=2024-01-02",
                "type=impression/day=2024-01-02",
                "type=impression/day=2024-01-03",
                "type=purchase/day=2024-01-03"), refs);

        PartitionMetadata day1 = partitions.get(1);
        assertEquals(3, day1.getRowCount());
        assertEquals(ts("2024-01-01T10:00:00Z"), day1.getTsMin());
        assertEquals(ts("2024-01-01T23:59:00Z"), day1.getTsMax());
    }

    @Test
    void testListPartitions_FiltersKindAndDayRange() {
        TestDataSets.writeAll(writer, TestDataSets.dailyRevenueEvents());

        List<PartitionMetadata> partitions = store.listPartitions(EnumSet.of(EventKind.IMPRESSION), DAY2, DAY3);

        assertEquals(List.of(new PartitionRef(EventKind.IMPRESSION, DAY2), new PartitionRef(EventKind.IMPRESSION, DAY3)),
                partitions.stream().map(PartitionMetadata::ref).collect(Collectors.toList()));
    }

    @Test
    void testScan_ProjectsAndFilters() {
        TestDataSets.writeAll(writer, TestDataSets.dailyRevenueEvents());
        List<EventColumn> columns = List.of(EventColumn.COUNTRY, EventColumn.BID_PRICE, EventColumn.HOUR);
        List<List<Object>> rows = new ArrayList<>();

        long matched = store.scan(new PartitionRef(EventKind.IMPRESSION, DAY1), columns,
                row -> "US".equals(row.get(0)),
                row -> rows.add(List.of(row.get(0), row.get(1), row.get(2))));

        assertEquals(2, matched);
        assertEquals(List.of(
                List.of("US", 1.0, LocalDateTime.of(2024, 1, 1, 10, 0)),
                List.of("US", 3.0, LocalDateTime.of(2024, 1, 1, 23, 0))), rows);
    }

    @Test
    void testScan_DerivesMissingTemporalColumnsAndType() {
        // Given a partition written without derived columns and without the type column
        List<EventRecord> events = List.of(
                impression("2024-01-01T09:30:00Z", 1.5, 1, "US", 1),
                impression("2024-01-01T08:00:00Z", 2.5, 1, "US", 1));
        writer.write(EventKind.IMPRESSION, DAY1, events, List.of(EventColumn.TS, EventColumn.BID_PRICE));
        List<List<Object>> rows = new ArrayList<>();

        // When
        store.scan(new PartitionRef(EventKind.IMPRESSION, DAY1),
                List.of(EventColumn.TYPE, EventColumn.DAY, EventColumn.MINUTE, EventColumn.BID_PRICE),
                row -> true,
                row -> rows.add(List.of(row.get(0), row.get(1), row.get(2), row.get(3))));

        // Then rows come back sorted by ts
        assertEquals(List.of(
                List.of("impression", DAY1, "2024-01-01 08:00", 2.5),
                List.of("impression", DAY1, "2024-01-01 09:30", 1.5)), rows);
    }

    @Test
    void testScan_MissingColumnFails() {
        writer.write(EventKind.IMPRESSION, DAY1, List.of(impression("2024-01-01T09:30:00Z", 1.5, 1, "US", 1)),
                List.of(EventColumn.TS, EventColumn.BID_PRICE));

        ColumnNotAvailableException e = assertThrows(ColumnNotAvailableException.class,
                () -> store.scan(new PartitionRef(EventKind.IMPRESSION, DAY1), List.of(EventColumn.COUNTRY),
                        row -> true, row -> { }));
        assertTrue(e.getMessage().contains("country"));
    }

    @Test
    void testScan_MissingPartitionFails() throws IOException {
        TestDataSets.writeAll(writer, TestDataSets.dailyRevenueEvents());
        PartitionRef ref = new PartitionRef(EventKind.IMPRESSION, DAY2);
        assertEquals(7, store.listPartitions().size());

        deleteRecursively(StoreLayout.partitionDir(root, ref));

        PartitionNotFoundException e = assertThrows(PartitionNotFoundException.class,
                () -> store.scan(ref, List.of(EventColumn.BID_PRICE), row -> true, row -> { }));
        assertEquals(ref, e.getPartition());
        assertThrows(PartitionNotFoundException.class,
                () -> store.scan(new PartitionRef(EventKind.SERVE, DAY1), List.of(EventColumn.TS), row -> true, row -> { }));
    }

    @Test
    void testWrite_PartitionsAreImmutable() {
        List<EventRecord> events = List.of(impression("2024-01-01T09:30:00Z", 1.5, 1, "US", 1));
        writer.write(EventKind.IMPRESSION, DAY1, events);

        assertThrows(StoreException.class, () -> writer.write(EventKind.IMPRESSION, DAY1, events));
        assertThrows(IllegalArgumentException.class, () -> writer.write(EventKind.CLICK, DAY1, events));
        assertThrows(IllegalArgumentException.class,
                () -> writer.write(EventKind.IMPRESSION, LocalDate.of(2024, 2, 1), events));
    }

    @Test
    void testRefresh_SeesNewPartitions() {
        writer.write(EventKind.IMPRESSION, DAY1, List.of(impression("2024-01-01T09:30:00Z", 1.5, 1, "US", 1)));
        assertEquals(1, store.listPartitions().size());

        writer.write(EventKind.IMPRESSION, DAY2, List.of(impression("2024-01-02T09:30:00Z", 1.5, 1, "US", 1)));
        assertEquals(1, store.listPartitions().size());

        store.refresh();
        assertEquals(2, store.listPartitions().size());
    }

    private static void deleteRecursively(Path dir) throws IOException {
        try (Stream<Path> walk = Files.walk(dir)) {
            for (Path path : walk.sorted(Comparator.reverseOrder()).collect(Collectors.toList())) {
                Files.delete(path);
            }
        }
    }
}

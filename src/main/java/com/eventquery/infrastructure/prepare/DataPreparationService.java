package com.eventquery.infrastructure.prepare;

import com.eventquery.domain.aggregation.Accumulator;
import com.eventquery.domain.aggregation.GroupKey;
import com.eventquery.domain.aggregation.GroupedAggregation;
import com.eventquery.domain.model.AggregateFunction;
import com.eventquery.domain.model.AggregateSelection;
import com.eventquery.domain.model.ColumnSelection;
import com.eventquery.domain.model.EventColumn;
import com.eventquery.domain.model.EventKind;
import com.eventquery.domain.model.EventRecord;
import com.eventquery.domain.model.Filter;
import com.eventquery.domain.model.Query;
import com.eventquery.domain.plan.ScanPlan;
import com.eventquery.domain.service.QueryExecutor;
import com.eventquery.domain.service.QueryPlanner;
import com.eventquery.infrastructure.cache.QueryCacheService;
import com.eventquery.infrastructure.catalog.AggregateCatalog;
import com.eventquery.infrastructure.catalog.AggregateRow;
import com.eventquery.infrastructure.catalog.AggregateTable;
import com.eventquery.infrastructure.catalog.AggregateTableDefinition;
import com.eventquery.infrastructure.store.PartitionMetadata;
import com.eventquery.infrastructure.store.PartitionRef;
import com.eventquery.infrastructure.store.PartitionStore;
import com.eventquery.infrastructure.store.PartitionWriter;
import com.eventquery.infrastructure.store.StoreException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.Reader;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Turns raw {@code events_part_*.csv} exports into the partitioned store and its
 * aggregate tables.
 *
 * Preparation Flow:
 * 1. Read every CSV file, typing cells and treating empty or {@code null} cells as null
 * 2. Group events by (kind, day) and write one immutable partition per group
 * 3. Rebuild every registered aggregate table by scanning the store
 * 4. Invalidate the query cache
 *
 * Tables are computed by the same scan path queries use, so a table lookup and a scan
 * of the same query agree by construction. Partitions that already exist are skipped.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DataPreparationService {

    static final String CSV_GLOB = "events_part_*.csv";

    private static final CSVFormat CSV_FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setTrim(true)
            .build();

    private final PartitionWriter partitionWriter;
    private final PartitionStore partitionStore;
    private final AggregateCatalog aggregateCatalog;
    private final QueryPlanner queryPlanner;
    private final QueryExecutor queryExecutor;
    private final QueryCacheService cacheService;

    public PreparationReport prepare(Path csvDir) {
        long startTime = System.currentTimeMillis();
        List<Path> files = csvFiles(csvDir);
        log.info("Preparing store from {} CSV files in {}", files.size(), csvDir);

        Map<PartitionRef, List<EventRecord>> grouped = new TreeMap<>();
        long eventsRead = 0;
        long rejected = 0;
        for (Path file : files) {
            ReadResult read = readFile(file);
            eventsRead += read.events.size();
            rejected += read.rejected;
            for (EventRecord event : read.events) {
                PartitionRef ref = new PartitionRef(event.getType(), (LocalDate) event.value(EventColumn.DAY));
                grouped.computeIfAbsent(ref, key -> new ArrayList<>()).add(event);
            }
        }

        Set<PartitionRef> existing = partitionStore.listPartitions().stream()
                .map(PartitionMetadata::ref)
                .collect(Collectors.toSet());
        int written = 0;
        int skipped = 0;
        for (Map.Entry<PartitionRef, List<EventRecord>> partition : grouped.entrySet()) {
            PartitionRef ref = partition.getKey();
            if (existing.contains(ref)) {
                log.warn("Partition {} already exists, skipping {} events", ref, partition.getValue().size());
                skipped++;
                continue;
            }
            partitionWriter.write(ref.getKind(), ref.getDay(), partition.getValue());
            written++;
        }
        partitionStore.refresh();
        log.info("Wrote {} partitions ({} skipped) from {} events, {} rows rejected",
                written, skipped, eventsRead, rejected);

        List<String> tables = buildAggregates();
        cacheService.invalidateAll();

        long elapsed = System.currentTimeMillis() - startTime;
        log.info("Preparation complete in {} ms", elapsed);
        return PreparationReport.builder()
                .filesRead(files.size())
                .eventsRead(eventsRead)
                .rowsRejected(rejected)
                .partitionsWritten(written)
                .partitionsSkipped(skipped)
                .tablesBuilt(tables)
                .elapsedMs(elapsed)
                .build();
    }

    /**
     * Rebuild every registered table from the partitions currently in the store.
     */
    public List<String> buildAggregates() {
        List<String> built = new ArrayList<>();
        for (AggregateTableDefinition definition : aggregateCatalog.definitions()) {
            AggregateTable table = buildTable(definition);
            aggregateCatalog.write(table);
            built.add(definition.getName());
        }
        aggregateCatalog.refresh();
        return built;
    }

    AggregateTable buildTable(AggregateTableDefinition definition) {
        AggregateSelection measure = definition.countsRows()
                ? AggregateSelection.countAll()
                : new AggregateSelection(AggregateFunction.AVG, definition.getValueColumn());

        Query.QueryBuilder query = Query.builder();
        for (EventColumn column : definition.getKeyColumns()) {
            query.select(new ColumnSelection(column)).groupBy(column);
        }
        query.select(measure);
        if (definition.getKindFilter() != null) {
            query.where(Filter.eq(EventColumn.TYPE, definition.getKindFilter().wireName()));
        }

        ScanPlan plan = queryPlanner.planScan(query.build());
        GroupedAggregation aggregation = queryExecutor.aggregate(plan);

        List<AggregateRow> rows = new ArrayList<>(aggregation.size());
        for (Map.Entry<GroupKey, Accumulator[]> group : aggregation.groups().entrySet()) {
            Accumulator state = group.getValue()[0];
            BigDecimal sum = definition.countsRows() ? BigDecimal.ZERO : state.getSum();
            rows.add(new AggregateRow(group.getKey().values(), sum, state.getCount()));
        }
        log.debug("Built {} from {} partitions: {} groups", definition.getName(), plan.getPartitions().size(), rows.size());
        return new AggregateTable(definition, rows);
    }

    private static List<Path> csvFiles(Path csvDir) {
        if (!Files.isDirectory(csvDir)) {
            throw new StoreException("CSV directory " + csvDir + " does not exist");
        }
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> listing = Files.newDirectoryStream(csvDir, CSV_GLOB)) {
            listing.forEach(files::add);
        } catch (IOException e) {
            throw new StoreException("Failed to list " + csvDir, e);
        }
        if (files.isEmpty()) {
            throw new StoreException("No " + CSV_GLOB + " files found in " + csvDir);
        }
        Collections.sort(files);
        return files;
    }

    ReadResult readFile(Path file) {
        List<EventRecord> events = new ArrayList<>();
        long rejected = 0;
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
             CSVParser parser = CSV_FORMAT.parse(reader)) {
            for (CSVRecord record : parser) {
                try {
                    events.add(toEvent(record));
                } catch (IllegalArgumentException e) {
                    rejected++;
                    log.warn("Rejected row {} of {}: {}", record.getRecordNumber(), file.getFileName(), e.getMessage());
                }
            }
        } catch (IOException e) {
            throw new StoreException("Failed to read " + file, e);
        }
        log.info("Read {} events from {} ({} rejected)", events.size(), file.getFileName(), rejected);
        return new ReadResult(events, rejected);
    }

    static EventRecord toEvent(CSVRecord record) {
        Long ts = (Long) cell(record, EventColumn.TS);
        if (ts == null) {
            throw new IllegalArgumentException("missing ts");
        }
        String type = (String) cell(record, EventColumn.TYPE);
        EventKind kind = EventKind.find(type)
                .orElseThrow(() -> new IllegalArgumentException("unknown event type '" + type + "'"));
        return EventRecord.builder()
                .ts(ts)
                .type(kind)
                .auctionId((String) cell(record, EventColumn.AUCTION_ID))
                .advertiserId((Long) cell(record, EventColumn.ADVERTISER_ID))
                .publisherId((Long) cell(record, EventColumn.PUBLISHER_ID))
                .bidPrice((Double) cell(record, EventColumn.BID_PRICE))
                .userId((Long) cell(record, EventColumn.USER_ID))
                .totalPrice((Double) cell(record, EventColumn.TOTAL_PRICE))
                .country((String) cell(record, EventColumn.COUNTRY))
                .build();
    }

    private static Object cell(CSVRecord record, EventColumn column) {
        if (!record.isMapped(column.columnName()) || !record.isSet(column.columnName())) {
            return null;
        }
        String raw = record.get(column.columnName());
        if (raw == null || raw.isEmpty() || raw.equalsIgnoreCase("null")) {
            return null;
        }
        return column.type().coerce(raw);
    }

    static final class ReadResult {

        final List<EventRecord> events;
        final long rejected;

        ReadResult(List<EventRecord> events, long rejected) {
            this.events = events;
            this.rejected = rejected;
        }
    }
}

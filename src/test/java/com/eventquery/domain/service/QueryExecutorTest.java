package com.eventquery.domain.service;

import com.eventquery.domain.model.EventColumn;
import com.eventquery.domain.model.EventKind;
import com.eventquery.domain.model.EventRecord;
import com.eventquery.domain.model.QueryRequest;
import com.eventquery.domain.model.QueryResult;
import com.eventquery.domain.plan.PlanType;
import com.eventquery.infrastructure.store.PartitionMetadata;
import com.eventquery.infrastructure.store.PartitionNotFoundException;
import com.eventquery.infrastructure.store.PartitionRef;
import com.eventquery.infrastructure.store.StoreLayout;
import com.eventquery.support.CountingPartitionStore;
import com.eventquery.support.TestDataSets;
import com.eventquery.support.TestEngine;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static com.eventquery.support.TestDataSets.DAY1;
import static com.eventquery.support.TestDataSets.DAY2;
import static com.eventquery.support.TestDataSets.DAY3;
import static com.eventquery.support.TestDataSets.agg;
import static com.eventquery.support.TestDataSets.dailyRevenueRequest;
import static com.eventquery.support.TestDataSets.filter;
import static com.eventquery.support.TestDataSets.order;
import static org.junit.jupiter.api.Assertions.*;

class QueryExecutorTest {

    @TempDir
    Path root;

    private TestEngine engine;

    @BeforeEach
    void setUp() {
        engine = new TestEngine(root.resolve("store"));
        TestDataSets.writeAll(engine.writer, TestDataSets.dailyRevenueEvents());
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    @Test
    void testDailyRevenue_Scan() {
        // When
        QueryResult result = engine.run(dailyRevenueRequest(), false);

        // Then
        assertEquals(List.of("day", "SUM(bid_price)"), result.getColumns());
        assertEquals(List.of(
                List.of(DAY1, 6.0),
                List.of(DAY2, 9.0),
                List.of(DAY3, 6.0)), result.getRows());
        assertEquals(PlanType.PARTITION_SCAN, result.getPlanType());
        assertEquals(3, result.getPartitionsScanned());
        assertEquals(6, result.getRowsMatched());
    }

    @Test
    void testDailyRevenue_Catalog() {
        // Given
        engine.preparation().buildAggregates();

        // When
        QueryResult result = engine.run(dailyRevenueRequest(), true);

        // Then
        assertEquals(PlanType.CATALOG_LOOKUP, result.getPlanType());
        assertEquals(0, result.getPartitionsScanned());
        assertEquals(List.of(
                List.of(DAY1, 6.0),
                List.of(DAY2, 9.0),
                List.of(DAY3, 6.0)), result.getRows());
    }

    @Test
    void testBetweenSingleDay_ScansOnePartition() {
        // Given
        CountingPartitionStore counting = new CountingPartitionStore(engine.store);
        QueryRequest request = dailyRevenueRequest();
        request.setWhere(List.of(filter("type", "eq", "impression"),
                filter("day", "between", List.of("2024-01-02", "2024-01-02"))));

        // When
        QueryResult result = engine.executor(counting)
                .execute(engine.planner(counting, false).plan(engine.parse(request)));

        // Then
        assertEquals(List.of(List.of(DAY2, 9.0)), result.getRows());
        assertEquals(Set.of(new PartitionRef(EventKind.IMPRESSION, DAY2)), counting.scanned());
    }

    @Test
    void testDayRangePruning_VisitsExactlyPartitionsInRange() {
        CountingPartitionStore counting = new CountingPartitionStore(engine.store);
        QueryRequest request = QueryRequest.builder()
                .select(List.of("type", agg("COUNT", "*")))
                .where(List.of(filter("day", "between", List.of("2024-01-02", "2024-01-03"))))
                .groupBy(List.of("type"))
                .build();

        QueryResult result = engine.executor(counting)
                .execute(engine.planner(counting, true).plan(engine.parse(request)));

        Set<PartitionRef> expected = engine.store.listPartitions().stream()
                .map(PartitionMetadata::ref)
                .filter(ref -> !ref.getDay().isBefore(DAY2) && !ref.getDay().isAfter(DAY3))
                .collect(Collectors.toSet());
        assertEquals(expected, counting.scanned());
        assertEquals(List.of(
                List.of("click", 1L),
                List.of("impression", 3L),
                List.of("purchase", 1L)), result.getRows());
    }

    @Test
    void testGroupedCount_NoMatchingRowsReturnsNoRows() {
        // purchases exist, none on 2024-01-02
        QueryRequest noPartition = QueryRequest.builder()
                .select(List.of("country", agg("COUNT", "*")))
                .where(List.of(filter("type", "eq", "purchase"), filter("day", "eq", "2024-01-02")))
                .groupBy(List.of("country"))
                .build();
        QueryRequest noRow = QueryRequest.builder()
                .select(List.of("country", agg("COUNT", "*")))
                .where(List.of(filter("type", "eq", "purchase"), filter("country", "eq", "JP")))
                .groupBy(List.of("country"))
                .build();

        QueryResult first = engine.run(noPartition, true);
        QueryResult second = engine.run(noRow, true);

        assertTrue(first.getRows().isEmpty());
        assertEquals(0, first.getPartitionsScanned());
        assertTrue(second.getRows().isEmpty());
        assertEquals(2, second.getPartitionsScanned());
        assertEquals(0, second.getRowsMatched());
    }

    @Test
    void testGlobalAggregate_AlwaysOneRow() {
        QueryRequest request = QueryRequest.builder()
                .select(List.of(agg("COUNT", "*"), agg("SUM", "bid_price"), agg("AVG", "bid_price")))
                .where(List.of(filter("country", "eq", "JP")))
                .build();

        QueryResult result = engine.run(request, true);

        assertEquals(1, result.getRowCount());
        assertEquals(Arrays.asList(0L, 0.0, null), result.getRows().get(0));
        assertEquals(7, result.getPartitionsScanned());
        assertEquals(0, result.getRowsMatched());
    }

    @Test
    void testGlobalAggregate_OverAllImpressions() {
        QueryRequest request = QueryRequest.builder()
                .select(List.of(agg("SUM", "bid_price"), agg("AVG", "bid_price"), agg("COUNT", "*")))
                .where(List.of(filter("type", "eq", "impression")))
                .build();

        QueryResult result = engine.run(request, true);

        assertEquals(List.of(List.of(21.0, 3.5, 6L)), result.getRows());
    }

    @Test
    void testGroupByWithoutAggregates_Distinct() {
        QueryRequest request = QueryRequest.builder()
                .select(List.of("country"))
                .where(List.of(filter("type", "eq", "impression")))
                .groupBy(List.of("country"))
                .build();

        QueryResult result = engine.run(request, true);

        // first-arrival order across partitions in day order
        assertEquals(List.of(List.of("US"), List.of("DE"), List.of("FR")), result.getRows());
    }

    @Test
    void testProjection_RowsInPartitionAndTimeOrder() {
        QueryRequest request = QueryRequest.builder()
                .select(List.of("minute", "bid_price"))
                .where(List.of(filter("type", "eq", "impression"), filter("country", "in", List.of("DE", "FR"))))
                .build();

        QueryResult result = engine.run(request, true);

        assertEquals(List.of(
                List.of("2024-01-01 10:30", 2.0),
                List.of("2024-01-02 12:00", 5.0),
                List.of("2024-01-03 08:15", 6.0)), result.getRows());
    }

    @Test
    void testProjection_OrderByDescending() {
        // Given
        QueryRequest request = QueryRequest.builder()
                .select(List.of("bid_price"))
                .where(List.of(filter("type", "eq", "impression")))
                .orderBy(List.of(order("bid_price", "desc")))
                .build();

        // When
        QueryResult result = engine.run(request, true);

        // Then
        assertEquals(List.of(List.of(6.0), List.of(5.0), List.of(4.0), List.of(3.0), List.of(2.0), List.of(1.0)),
                result.getRows());
    }

    @Test
    void testProjection_OrderByAcrossPartitionsKeepsTiesInScanOrder() {
        QueryRequest request = QueryRequest.builder()
                .select(List.of("country", "minute"))
                .where(List.of(filter("type", "eq", "impression")))
                .orderBy(List.of(order("country", "asc")))
                .build();

        QueryResult result = engine.run(request, false);

        assertEquals(List.of(
                List.of("DE", "2024-01-01 10:30"),
                List.of("DE", "2024-01-03 08:15"),
                List.of("FR", "2024-01-02 12:00"),
                List.of("US", "2024-01-01 10:00"),
                List.of("US", "2024-01-01 23:59"),
                List.of("US", "2024-01-02 00:00")), result.getRows());
    }

    @Test
    void testOrderBy_NullsLastAndStable() {
        QueryRequest request = QueryRequest.builder()
                .select(List.of("country", agg("AVG", "total_price")))
                .groupBy(List.of("country"))
                .orderBy(List.of(order("AVG(total_price)", "desc")))
                .build();

        QueryResult desc = engine.run(request, true);
        request.setOrderBy(List.of(order("avg(total_price)", "asc")));
        QueryResult asc = engine.run(request, true);

        assertEquals(Arrays.asList(
                Arrays.asList("DE", 35.5),
                Arrays.asList("US", 20.0),
                Arrays.asList("FR", null)), desc.getRows());
        assertEquals(Arrays.asList(
                Arrays.asList("US", 20.0),
                Arrays.asList("DE", 35.5),
                Arrays.asList("FR", null)), asc.getRows());
    }

    @Test
    void testExecute_IsRepeatable() {
        QueryRequest request = QueryRequest.builder()
                .select(List.of("publisher_id", "hour", agg("SUM", "bid_price")))
                .where(List.of(filter("type", "eq", "impression")))
                .groupBy(List.of("publisher_id", "hour"))
                .build();

        assertEquals(engine.run(request, false).getRows(), engine.run(request, false).getRows());
    }

    @Test
    void testMissingPartition_AbortsQuery() throws IOException {
        // Given metadata is loaded, then a partition disappears
        assertEquals(7, engine.store.listPartitions().size());
        Path dir = StoreLayout.partitionDir(engine.root, new PartitionRef(EventKind.IMPRESSION, DAY2));
        try (Stream<Path> walk = Files.walk(dir)) {
            for (Path path : walk.sorted(Comparator.reverseOrder()).collect(Collectors.toList())) {
                Files.delete(path);
            }
        }

        // When / Then
        PartitionNotFoundException e = assertThrows(PartitionNotFoundException.class,
                () -> engine.run(dailyRevenueRequest(), false));
        assertTrue(e.getMessage().contains("type=impression/day=2024-01-02"));
    }

    @Test
    void testCatalogAndScanAgree() {
        // Given
        engine.preparation().buildAggregates();
        List<QueryRequest> requests = List.of(
                dailyRevenueRequest(),
                QueryRequest.builder()
                        .select(List.of("country", agg("SUM", "bid_price"), agg("AVG", "bid_price"), agg("COUNT", "bid_price")))
                        .where(List.of(filter("type", "eq", "impression")))
                        .groupBy(List.of("country"))
                        .build(),
                QueryRequest.builder()
                        .select(List.of("day", agg("AVG", "bid_price")))
                        .where(List.of(filter("type", "eq", "impression"), filter("publisher_id", "in", List.of(10, 12))))
                        .groupBy(List.of("day"))
                        .build(),
                QueryRequest.builder()
                        .select(List.of("country", agg("SUM", "total_price")))
                        .where(List.of(filter("type", "eq", "purchase")))
                        .groupBy(List.of("country"))
                        .build(),
                QueryRequest.builder()
                        .select(List.of("advertiser_id", agg("COUNT", "*")))
                        .where(List.of(filter("type", "eq", "click")))
                        .groupBy(List.of("advertiser_id"))
                        .build(),
                QueryRequest.builder()
                        .select(List.of("type", "advertiser_id", agg("COUNT", "*")))
                        .groupBy(List.of("type", "advertiser_id"))
                        .build(),
                QueryRequest.builder()
                        .select(List.of(agg("SUM", "bid_price")))
                        .where(List.of(filter("type", "eq", "impression"), filter("day", "between", List.of("2024-01-02", "2024-01-03"))))
                        .build(),
                QueryRequest.builder()
                        .select(List.of("minute", agg("SUM", "bid_price")))
                        .where(List.of(filter("type", "eq", "impression"), filter("day", "eq", "2024-01-01")))
                        .groupBy(List.of("minute"))
                        .build());

        for (QueryRequest request : requests) {
            // When
            QueryResult catalog = engine.run(request, true);
            QueryResult scan = engine.run(request, false);

            // Then
            assertEquals(PlanType.CATALOG_LOOKUP, catalog.getPlanType(), "catalog plan for " + request);
            assertNotEquals(PlanType.CATALOG_LOOKUP, scan.getPlanType());
            assertEquals(sorted(scan.getRows()), sorted(catalog.getRows()), "rows for " + request);
        }
    }

    @Test
    void testScanMatchesBruteForce() {
        // Given
        List<EventRecord> events = randomEvents(new Random(7), 400);
        try (TestEngine random = new TestEngine(root.resolve("random"))) {
            TestDataSets.writeAll(random.writer, events);

            // SUM by country over impressions
            QueryResult sums = random.run(QueryRequest.builder()
                    .select(List.of("country", agg("SUM", "bid_price")))
                    .where(List.of(filter("type", "eq", "impression")))
                    .groupBy(List.of("country"))
                    .build(), false);
            Map<Object, BigDecimal> expectedSums = new LinkedHashMap<>();
            events.stream()
                    .filter(event -> event.getType() == EventKind.IMPRESSION)
                    .forEach(event -> expectedSums.merge(event.getCountry(),
                            event.getBidPrice() == null ? BigDecimal.ZERO : BigDecimal.valueOf(event.getBidPrice()),
                            BigDecimal::add));
            assertEquals(expectedSums.size(), sums.getRowCount());
            for (List<Object> row : sums.getRows()) {
                assertEquals(expectedSums.get(row.get(0)).doubleValue(), (Double) row.get(1), 1e-9);
            }

            // COUNT(*) by (day, type)
            QueryResult counts = random.run(QueryRequest.builder()
                    .select(List.of("day", "type", agg("COUNT", "*")))
                    .groupBy(List.of("day", "type"))
                    .build(), false);
            Map<List<Object>, Long> expectedCounts = events.stream().collect(Collectors.groupingBy(
                    event -> List.of(event.value(EventColumn.DAY), event.value(EventColumn.TYPE)), Collectors.counting()));
            assertEquals(expectedCounts, counts.getRows().stream().collect(Collectors.toMap(
                    row -> List.of(row.get(0), row.get(1)), row -> (Long) row.get(2))));

            // AVG by advertiser over purchases on two days
            QueryResult averages = random.run(QueryRequest.builder()
                    .select(List.of("advertiser_id", agg("AVG", "total_price")))
                    .where(List.of(filter("type", "eq", "purchase"), filter("day", "in", List.of("2024-01-02", "2024-01-04"))))
                    .groupBy(List.of("advertiser_id"))
                    .build(), false);
            Map<Object, List<Double>> prices = new LinkedHashMap<>();
            events.stream()
                    .filter(event -> event.getType() == EventKind.PURCHASE)
                    .filter(event -> Set.of(LocalDate.of(2024, 1, 2), LocalDate.of(2024, 1, 4)).contains(event.value(EventColumn.DAY)))
                    .forEach(event -> {
                        List<Double> values = prices.computeIfAbsent(event.getAdvertiserId(), key -> new ArrayList<>());
                        if (event.getTotalPrice() != null) {
                            values.add(event.getTotalPrice());
                        }
                    });
            assertEquals(prices.size(), averages.getRowCount());
            for (List<Object> row : averages.getRows()) {
                List<Double> values = prices.get(row.get(0));
                if (values.isEmpty()) {
                    assertNull(row.get(1));
                } else {
                    double mean = values.stream().mapToDouble(Double::doubleValue).average().orElseThrow();
                    assertEquals(mean, (Double) row.get(1), 1e-9);
                }
            }
        }
    }

    private static List<EventRecord> randomEvents(Random random, int count) {
        String[] countries = {"US", "DE", "FR", "JP", null};
        EventKind[] kinds = {EventKind.SERVE, EventKind.IMPRESSION, EventKind.CLICK, EventKind.PURCHASE};
        long start = TestDataSets.ts("2024-01-01T00:00:00Z");
        List<EventRecord> events = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            EventKind kind = kinds[random.nextInt(kinds.length)];
            events.add(EventRecord.builder()
                    .ts(start + (long) random.nextInt(5 * 24 * 60) * 60_000L)
                    .type(kind)
                    .auctionId("r-" + i)
                    .advertiserId((long) random.nextInt(4))
                    .publisherId((long) random.nextInt(3))
                    .bidPrice(kind == EventKind.IMPRESSION && random.nextInt(20) > 0 ? random.nextInt(1000) / 100.0 : null)
                    .totalPrice(kind == EventKind.PURCHASE && random.nextInt(10) > 0 ? random.nextInt(50_000) / 100.0 : null)
                    .userId((long) random.nextInt(50))
                    .country(countries[random.nextInt(countries.length)])
                    .build());
        }
        return events;
    }

    private static List<List<Object>> sorted(List<List<Object>> rows) {
        List<List<Object>> copy = new ArrayList<>(rows);
        copy.sort(Comparator.comparing((Function<List<Object>, String>) Object::toString));
        return copy;
    }
}

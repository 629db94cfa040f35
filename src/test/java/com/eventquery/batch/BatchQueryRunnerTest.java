package com.eventquery.batch;

import com.eventquery.domain.exception.InvalidQueryException;
import com.eventquery.domain.model.QueryRequest;
import com.eventquery.domain.model.QueryResult;
import com.eventquery.domain.plan.PlanType;
import com.eventquery.domain.service.QueryService;
import com.eventquery.infrastructure.export.CsvResultWriter;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BatchQueryRunnerTest {

    private static final String DAILY = "{\"select\": [\"day\", {\"SUM\": \"bid_price\"}], \"from\": \"events\","
            + " \"where\": [{\"col\": \"type\", \"op\": \"eq\", \"val\": \"impression\"}], \"group_by\": [\"day\"]}";
    private static final String BROKEN = "{\"select\": [\"nope\"]}";

    @Mock
    private QueryService queryService;

    @TempDir
    Path tempDir;

    private BatchQueryRunner runner;

    @BeforeEach
    void setUp() {
        runner = new BatchQueryRunner(queryService, new CsvResultWriter(), new ObjectMapper());
    }

    @Test
    void testLoadQueries_AcceptsListAndObject() throws IOException {
        // Given
        Path list = Files.writeString(tempDir.resolve("list.json"), "[" + DAILY + ", " + BROKEN + "]");
        Path object = Files.writeString(tempDir.resolve("object.json"), "{\"queries\": [" + DAILY + "]}");

        // When
        List<QueryRequest> fromList = runner.loadQueries(list);
        List<QueryRequest> fromObject = runner.loadQueries(object);

        // Then
        assertEquals(2, fromList.size());
        assertEquals(1, fromObject.size());
        QueryRequest daily = fromObject.get(0);
        assertEquals("day", daily.getSelect().get(0));
        assertEquals(Map.of("SUM", "bid_price"), daily.getSelect().get(1));
        assertEquals(List.of("day"), daily.getGroupBy());
        assertEquals("impression", daily.getWhere().get(0).getVal());
    }

    @Test
    void testLoadQueries_RejectsOtherShapes() throws IOException {
        Path scalar = Files.writeString(tempDir.resolve("scalar.json"), "42");
        Path noList = Files.writeString(tempDir.resolve("nolist.json"), "{\"select\": [\"day\"]}");

        assertThrows(IllegalArgumentException.class, () -> runner.loadQueries(scalar));
        assertThrows(IllegalArgumentException.class, () -> runner.loadQueries(noList));
    }

    @Test
    void testRunBatch_FailingQueryDoesNotStopBatch() throws IOException {
        // Given
        Path queries = Files.writeString(tempDir.resolve("queries.json"),
                "[" + DAILY + ", " + BROKEN + ", " + DAILY + "]");
        Path out = tempDir.resolve("out");

        when(queryService.execute(any(QueryRequest.class)))
                .thenAnswer(invocation -> dailyResult())
                .thenThrow(new InvalidQueryException("Unknown column 'nope'"))
                .thenAnswer(invocation -> dailyResult());

        // When
        List<BatchOutcome> outcomes = runner.runBatch(queries, out);

        // Then
        assertEquals(3, outcomes.size());
        assertFalse(outcomes.get(0).isFailed());
        assertEquals(2, outcomes.get(0).getRows());
        assertTrue(outcomes.get(1).isFailed());
        assertEquals("Unknown column 'nope'", outcomes.get(1).getError());
        assertFalse(outcomes.get(2).isFailed());

        assertEquals("day,SUM(bid_price)\n2024-01-01,6.0\n2024-01-02,9.0\n", Files.readString(out.resolve("q1.csv")));
        assertFalse(Files.exists(out.resolve("q2.csv")));
        assertTrue(Files.exists(out.resolve("q3.csv")));
        verify(queryService, times(3)).execute(any(QueryRequest.class));
    }

    private static QueryResult dailyResult() {
        List<List<Object>> rows = new ArrayList<>();
        rows.add(List.of(LocalDate.of(2024, 1, 1), 6.0));
        rows.add(List.of(LocalDate.of(2024, 1, 2), 9.0));
        return QueryResult.builder()
                .columns(List.of("day", "SUM(bid_price)"))
                .rows(rows)
                .planType(PlanType.CATALOG_LOOKUP)
                .queryTimeMs(3)
                .build();
    }
}

package com.eventquery.batch;

import com.eventquery.domain.model.QueryRequest;
import com.eventquery.domain.model.QueryResult;
import com.eventquery.domain.service.QueryService;
import com.eventquery.infrastructure.export.CsvResultWriter;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Executes a file of queries at startup and writes each result to {@code q<i>.csv}.
 *
 * The file holds either a JSON list of queries or an object with a {@code queries} list.
 * A failing query is logged and the batch moves on to the next one.
 */
@Slf4j
@Component
@Order(2)
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.batch.queries-file")
public class BatchQueryRunner implements ApplicationRunner {

    private final QueryService queryService;
    private final CsvResultWriter csvResultWriter;
    private final ObjectMapper objectMapper;

    @Value("${app.batch.queries-file}")
    private String queriesFile;

    @Value("${app.batch.out-dir:out}")
    private String outDir;

    @Override
    public void run(ApplicationArguments args) {
        runBatch(Path.of(queriesFile), Path.of(outDir));
    }

    public List<BatchOutcome> runBatch(Path queries, Path out) {
        List<QueryRequest> requests = loadQueries(queries);
        log.info("Loaded {} queries from {}", requests.size(), queries);

        List<BatchOutcome> outcomes = new ArrayList<>(requests.size());
        for (int i = 0; i < requests.size(); i++) {
            int index = i + 1;
            try {
                QueryResult result = queryService.execute(requests.get(i));
                csvResultWriter.write(result, out.resolve("q" + index + ".csv"));
                log.info("Query {}: {} rows, {} ms, plan={}", index, result.getRowCount(),
                        result.getQueryTimeMs(), result.getPlanType());
                outcomes.add(new BatchOutcome(index, result.getRowCount(), result.getQueryTimeMs(), result.isCached(), null));
            } catch (IOException | RuntimeException e) {
                log.error("Query {} failed: {}", index, e.getMessage());
                outcomes.add(new BatchOutcome(index, 0, 0, false, e.getMessage()));
            }
        }
        logSummary(outcomes);
        return outcomes;
    }

    List<QueryRequest> loadQueries(Path file) {
        JsonNode root;
        try {
            root = objectMapper.readTree(file.toFile());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read queries file " + file, e);
        }
        JsonNode list = root != null && root.isObject() ? root.get("queries") : root;
        if (list == null || !list.isArray()) {
            throw new IllegalArgumentException("Queries file " + file
                    + " must contain a list of queries or an object with a 'queries' list");
        }
        List<QueryRequest> requests = new ArrayList<>(list.size());
        for (JsonNode node : list) {
            requests.add(objectMapper.convertValue(node, QueryRequest.class));
        }
        return requests;
    }

    private static void logSummary(List<BatchOutcome> outcomes) {
        long totalTime = 0;
        int failed = 0;
        for (BatchOutcome outcome : outcomes) {
            if (outcome.isFailed()) {
                failed++;
                log.info("Q{}: ERROR - {}", outcome.getIndex(), outcome.getError());
            } else {
                totalTime += outcome.getTimeMs();
                log.info("Q{}: {} ms ({} rows)", outcome.getIndex(), outcome.getTimeMs(), outcome.getRows());
            }
        }
        log.info("Batch finished: {} queries, {} failed, total {} ms", outcomes.size(), failed, totalTime);
    }
}

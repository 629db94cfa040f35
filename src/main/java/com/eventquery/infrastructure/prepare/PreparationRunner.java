package com.eventquery.infrastructure.prepare;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Runs preparation at startup when {@code app.prepare.csv-dir} is set. Runs before any
 * batch of queries.
 */
@Slf4j
@Component
@Order(1)
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.prepare.csv-dir")
public class PreparationRunner implements ApplicationRunner {

    private final DataPreparationService preparationService;

    @Value("${app.prepare.csv-dir}")
    private String csvDir;

    @Override
    public void run(ApplicationArguments args) {
        PreparationReport report = preparationService.prepare(Path.of(csvDir));
        log.info("Prepared {} events into {} partitions, tables {}",
                report.getEventsRead(), report.getPartitionsWritten(), report.getTablesBuilt());
    }
}

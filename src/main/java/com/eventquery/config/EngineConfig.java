package com.eventquery.config;

import com.eventquery.infrastructure.catalog.AggregateCatalog;
import com.eventquery.infrastructure.catalog.DefaultAggregateTables;
import com.eventquery.infrastructure.catalog.FileSystemAggregateCatalog;
import com.eventquery.infrastructure.store.FileSystemPartitionStore;
import com.eventquery.infrastructure.store.PartitionStore;
import com.eventquery.infrastructure.store.PartitionWriter;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the file-system store, the aggregate catalog and the partition scan pool.
 */
@Slf4j
@Configuration
public class EngineConfig {

    @Value("${app.data-dir:optimized_data}")
    private String dataDir;

    @Value("${app.scan.parallelism:0}")
    private int scanParallelism;

    @Bean
    public PartitionStore partitionStore(ObjectMapper objectMapper) {
        log.info("Partition store root: {}", dataRoot().toAbsolutePath());
        return new FileSystemPartitionStore(dataRoot(), objectMapper);
    }

    @Bean
    public PartitionWriter partitionWriter(ObjectMapper objectMapper) {
        return new PartitionWriter(dataRoot(), objectMapper);
    }

    @Bean
    public AggregateCatalog aggregateCatalog(ObjectMapper objectMapper) {
        return new FileSystemAggregateCatalog(dataRoot(), objectMapper, DefaultAggregateTables.ALL);
    }

    /**
     * Fixed pool for per-partition scan tasks. 0 means one thread per available processor.
     */
    @Bean(name = "scanExecutor", destroyMethod = "shutdown")
    public ExecutorService scanExecutor() {
        int threads = scanParallelism > 0 ? scanParallelism : Runtime.getRuntime().availableProcessors();
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "partition-scan-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        log.info("Partition scan pool: {} threads", threads);
        return Executors.newFixedThreadPool(threads, threadFactory);
    }

    private Path dataRoot() {
        return Path.of(dataDir);
    }
}

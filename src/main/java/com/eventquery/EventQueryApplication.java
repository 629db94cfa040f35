package com.eventquery;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Event query engine.
 *
 * Answers grouped aggregate queries over ad-serving events stored in (kind, day)
 * partitions, using precomputed aggregate tables where they apply.
 *
 * Components:
 * - HTTP API for queries, plans and store metadata
 * - Preparation run turning CSV exports into the partitioned store
 * - Batch run executing a file of queries into CSV files
 */
@SpringBootApplication
public class EventQueryApplication {

    public static void main(String[] args) {
        SpringApplication.run(EventQueryApplication.class, args);
    }
}

package com.eventquery.infrastructure.store;

import com.eventquery.domain.model.EventColumn;

import java.nio.file.Path;

/**
 * Directory layout of a store root:
 * <pre>
 * root/partitioned/type=impression/day=2024-01-01/_partition.json
 * root/partitioned/type=impression/day=2024-01-01/bid_price.json
 * root/aggregates/daily_revenue.json
 * </pre>
 */
public final class StoreLayout {

    public static final String PARTITIONED_DIR = "partitioned";
    public static final String AGGREGATES_DIR = "aggregates";
    public static final String METADATA_FILE = "_partition.json";
    public static final String TYPE_PREFIX = "type=";
    public static final String DAY_PREFIX = "day=";

    private StoreLayout() {
    }

    public static Path partitionedRoot(Path root) {
        return root.resolve(PARTITIONED_DIR);
    }

    public static Path aggregatesRoot(Path root) {
        return root.resolve(AGGREGATES_DIR);
    }

    public static Path partitionDir(Path root, PartitionRef ref) {
        return partitionedRoot(root)
                .resolve(TYPE_PREFIX + ref.getKind().wireName())
                .resolve(DAY_PREFIX + ref.getDay());
    }

    public static Path columnFile(Path partitionDir, EventColumn column) {
        return partitionDir.resolve(column.columnName() + ".json");
    }
}

package com.eventquery.infrastructure.store;

/**
 * Read-only view of the current row during a scan. Index {@code i} is the i-th column
 * of the projection passed to {@link PartitionStore#scan}. Views are reused between
 * rows, so callers copy values they need to keep.
 */
public interface ProjectedRow {

    Object get(int columnIndex);
}

package com.eventquery.domain.plan;

public enum PlanType {
    CATALOG_LOOKUP,
    PARTITION_SCAN,
    FULL_SCAN
}

package com.eventquery.domain.plan;

import com.eventquery.domain.model.Query;

/**
 * Strategy chosen for one query. Implementations are immutable values: planning the
 * same query twice against the same store yields equal plans.
 */
public interface ExecutionPlan {

    PlanType getType();

    Query getQuery();

    /** One-line human readable summary, used for logs and the explain endpoint. */
    String describe();
}

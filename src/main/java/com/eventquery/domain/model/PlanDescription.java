package com.eventquery.domain.model;

import com.eventquery.domain.plan.PlanType;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * What the planner decided for a query, without running it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PlanDescription {

    private PlanType planType;
    private String description;
    private String table;
    private Boolean reaggregate;
    private List<String> partitions;
    private List<String> projectedColumns;
    private List<String> residualFilters;
}

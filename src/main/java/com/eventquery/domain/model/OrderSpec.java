package com.eventquery.domain.model;

import lombok.Value;

/**
 * Sort key referencing a select output by position.
 */
@Value
public class OrderSpec {

    int outputIndex;
    boolean descending;
}

package com.eventquery.infrastructure.catalog;

import com.eventquery.domain.model.EventKind;

import java.util.List;

import static com.eventquery.domain.model.EventColumn.ADVERTISER_ID;
import static com.eventquery.domain.model.EventColumn.BID_PRICE;
import static com.eventquery.domain.model.EventColumn.COUNTRY;
import static com.eventquery.domain.model.EventColumn.DAY;
import static com.eventquery.domain.model.EventColumn.MINUTE;
import static com.eventquery.domain.model.EventColumn.PUBLISHER_ID;
import static com.eventquery.domain.model.EventColumn.TOTAL_PRICE;
import static com.eventquery.domain.model.EventColumn.TYPE;

/**
 * Tables built by the preparation step. New precomputed aggregates are added here;
 * the planner picks them up through their signatures.
 */
public final class DefaultAggregateTables {

    public static final List<AggregateTableDefinition> ALL = List.of(
            new AggregateTableDefinition("daily_revenue", EventKind.IMPRESSION, List.of(DAY), BID_PRICE),
            new AggregateTableDefinition("country_revenue", EventKind.IMPRESSION, List.of(COUNTRY), BID_PRICE),
            new AggregateTableDefinition("country_purchases", EventKind.PURCHASE, List.of(COUNTRY), TOTAL_PRICE),
            new AggregateTableDefinition("publisher_day_country_revenue", EventKind.IMPRESSION,
                    List.of(PUBLISHER_ID, DAY, COUNTRY), BID_PRICE),
            new AggregateTableDefinition("advertiser_type_counts", null, List.of(ADVERTISER_ID, TYPE), null),
            new AggregateTableDefinition("minute_revenue", EventKind.IMPRESSION, List.of(DAY, MINUTE), BID_PRICE)
    );

    private DefaultAggregateTables() {
    }
}

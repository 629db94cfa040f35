package com.eventquery.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * One raw event as produced by the ad-serving log. Only the preparation step sees
 * these; queries read the partitioned columnar form.
 */
@Value
@Builder
public class EventRecord {

    long ts;
    EventKind type;
    String auctionId;
    Long advertiserId;
    Long publisherId;
    Double bidPrice;
    Long userId;
    Double totalPrice;
    String country;

    public Object value(EventColumn column) {
        switch (column) {
            case TS:
                return ts;
            case TYPE:
                return type.wireName();
            case AUCTION_ID:
                return auctionId;
            case ADVERTISER_ID:
                return advertiserId;
            case PUBLISHER_ID:
                return publisherId;
            case BID_PRICE:
                return bidPrice;
            case USER_ID:
                return userId;
            case TOTAL_PRICE:
                return totalPrice;
            case COUNTRY:
                return country;
            default:
                return DerivedColumns.derive(column, ts);
        }
    }
}

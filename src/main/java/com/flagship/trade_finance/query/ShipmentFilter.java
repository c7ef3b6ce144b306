package com.flagship.trade_finance.query;

import lombok.Builder;
import lombok.Value;

/**
 * Optional filters for listing shipments. Null fields are not sent.
 */
@Value
@Builder
public class ShipmentFilter {
    String seller;
    String buyer;
    String carrier;
    Boolean active;

    public static ShipmentFilter all() {
        return ShipmentFilter.builder().build();
    }
}

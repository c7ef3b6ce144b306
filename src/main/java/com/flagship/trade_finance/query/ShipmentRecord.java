package com.flagship.trade_finance.query;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Shipment as indexed by the query service. Amounts are decimal token strings,
 * timestamps ISO-8601 strings (with or without offset).
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class ShipmentRecord {
    String bolHash;
    @JsonAlias("billOfLadingAddress")
    String contractAddress;
    String seller;
    String buyer;
    @JsonAlias("carrierName")
    String carrier;
    String blNumber;
    String pdfUrl;
    String declaredValue;
    String totalFunded;
    String totalPaid;
    @JsonAlias("totalClaimed")
    String totalRepaid;
    String mintedAt;
    String fundingEnabledAt;
    String arrivedAt;
    String paidAt;
    String settledAt;
}

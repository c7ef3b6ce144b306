package com.flagship.trade_finance.query;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Registration payload sent to the query service, which mints the shipment
 * on the ledger on behalf of the carrier.
 */
@Value
@Builder
public class RegisterShipmentCommand {
    String bolHash;
    JsonNode document;
    BigDecimal declaredValue;
    String carrier;
    String seller;
    String buyer;
    String pdfUrl;
}

package com.flagship.trade_finance.trade;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * A new shipment: its document, declared value in tokens and the three parties.
 */
@Value
@Builder
public class ShipmentRegistration {
    JsonNode document;
    BigDecimal declaredValue;
    String carrier;
    String seller;
    String buyer;
    String pdfUrl;
}

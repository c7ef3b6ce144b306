package com.flagship.trade_finance.trade.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

/**
 * Registration request. {@code document} is the bill of lading as extracted
 * upstream; its canonical form determines the BoL hash.
 */
@Value
@Builder
@Jacksonized
public class RegisterShipmentRequest {

    @NotNull(message = "Shipment document is required")
    @JsonProperty("document")
    JsonNode document;

    @NotNull(message = "Declared value is required")
    @DecimalMin(value = "0", inclusive = false, message = "Declared value must be greater than 0")
    @JsonProperty("declared_value")
    BigDecimal declaredValue;

    @NotBlank(message = "Carrier account is required")
    @JsonProperty("carrier")
    String carrier;

    @NotBlank(message = "Seller account is required")
    @JsonProperty("seller")
    String seller;

    @NotBlank(message = "Buyer account is required")
    @JsonProperty("buyer")
    String buyer;

    @JsonProperty("pdf_url")
    String pdfUrl;
}

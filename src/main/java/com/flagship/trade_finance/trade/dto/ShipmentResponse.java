package com.flagship.trade_finance.trade.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.trade_finance.lifecycle.LifecycleStage;
import com.flagship.trade_finance.reconcile.ShipmentSnapshot;
import com.flagship.trade_finance.shipment.Shipment;
import com.flagship.trade_finance.shipment.TokenAmounts;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Cached view of a shipment. Amounts are in tokens.
 */
@Value
@Builder
public class ShipmentResponse {

    @JsonProperty("bol_hash")
    String bolHash;

    @JsonProperty("contract_address")
    String contractAddress;

    @JsonProperty("seller")
    String seller;

    @JsonProperty("buyer")
    String buyer;

    @JsonProperty("carrier")
    String carrier;

    @JsonProperty("bl_number")
    String blNumber;

    @JsonProperty("document_url")
    String documentUrl;

    @JsonProperty("stage")
    LifecycleStage stage;

    @JsonProperty("provisional")
    boolean provisional;

    @JsonProperty("declared_value")
    BigDecimal declaredValue;

    @JsonProperty("total_funded")
    BigDecimal totalFunded;

    @JsonProperty("remaining_capacity")
    BigDecimal remainingCapacity;

    @JsonProperty("total_paid")
    BigDecimal totalPaid;

    @JsonProperty("total_repaid")
    BigDecimal totalRepaid;

    @JsonProperty("minted_at")
    Instant mintedAt;

    @JsonProperty("funding_enabled_at")
    Instant fundingEnabledAt;

    @JsonProperty("arrived_at")
    Instant arrivedAt;

    @JsonProperty("paid_at")
    Instant paidAt;

    @JsonProperty("settled_at")
    Instant settledAt;

    @JsonProperty("refreshed_at")
    Instant refreshedAt;

    public static ShipmentResponse from(ShipmentSnapshot snapshot, LifecycleStage stage, TokenAmounts tokens) {
        Shipment shipment = snapshot.getShipment();
        return ShipmentResponse.builder()
                .bolHash(shipment.getBolHash())
                .contractAddress(shipment.getContractAddress())
                .seller(shipment.getSeller())
                .buyer(shipment.getBuyer())
                .carrier(shipment.getCarrier())
                .blNumber(shipment.getBlNumber())
                .documentUrl(shipment.getDocumentUrl())
                .stage(stage)
                .provisional(snapshot.isProvisional())
                .declaredValue(tokens.toTokens(shipment.getDeclaredValue()))
                .totalFunded(tokens.toTokens(shipment.getTotalFunded()))
                .remainingCapacity(tokens.toTokens(shipment.remainingCapacity()))
                .totalPaid(tokens.toTokens(shipment.getTotalPaid()))
                .totalRepaid(tokens.toTokens(shipment.getTotalRepaid()))
                .mintedAt(shipment.getMintedAt())
                .fundingEnabledAt(shipment.getFundingEnabledAt())
                .arrivedAt(shipment.getArrivedAt())
                .paidAt(shipment.getPaidAt())
                .settledAt(shipment.getSettledAt())
                .refreshedAt(snapshot.getRefreshedAt())
                .build();
    }
}

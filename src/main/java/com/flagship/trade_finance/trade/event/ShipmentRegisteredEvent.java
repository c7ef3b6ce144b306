package com.flagship.trade_finance.trade.event;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Published when a shipment is registered through this service.
 */
@Value
public class ShipmentRegisteredEvent implements ShipmentEvent {
    UUID eventId;
    String shipmentId;
    String contractAddress;
    String carrier;
    BigDecimal declaredValue;
    Instant occurredAt;

    public static final String EVENT_TYPE = "ShipmentRegistered";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static ShipmentRegisteredEvent of(String shipmentId, String contractAddress,
                                             String carrier, BigDecimal declaredValue) {
        return new ShipmentRegisteredEvent(UUID.randomUUID(), shipmentId, contractAddress,
                carrier, declaredValue, Instant.now());
    }
}

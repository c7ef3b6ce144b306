package com.flagship.trade_finance.trade.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Base interface for shipment events.
 *
 * Every event carries its own id for consumer deduplication and the shipment
 * hash it concerns, which is also the Kafka key.
 */
public interface ShipmentEvent {

    UUID getEventId();

    String getShipmentId();

    Instant getOccurredAt();

    String getEventType();
}

package com.flagship.trade_finance.consumer;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Marks an event as handled by one consumer group, so a redelivered or
 * replayed event is not handled twice.
 */
@Value
public class ProcessedEvent {
    UUID eventId;
    String eventType;
    String shipmentId;
    String consumerGroup;
    Instant processedAt;
    ProcessingResult result;
    String note;

    public enum ProcessingResult {
        SUCCESS,
        SKIPPED     // not relevant, or not applicable to the current state
    }

    public static ProcessedEvent success(UUID eventId, String eventType, String shipmentId, String consumerGroup) {
        return new ProcessedEvent(eventId, eventType, shipmentId, consumerGroup,
                Instant.now(), ProcessingResult.SUCCESS, null);
    }

    public static ProcessedEvent skipped(UUID eventId, String eventType, String shipmentId,
                                         String consumerGroup, String reason) {
        return new ProcessedEvent(eventId, eventType, shipmentId, consumerGroup,
                Instant.now(), ProcessingResult.SKIPPED, reason);
    }
}

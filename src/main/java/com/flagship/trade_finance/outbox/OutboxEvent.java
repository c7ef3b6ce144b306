package com.flagship.trade_finance.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A shipment event waiting in the outbox.
 *
 * Written in the same transaction as the action record it describes and
 * published to Kafka later by {@link OutboxPublisher}. The aggregate id is the
 * shipment hash, which is also the Kafka key, so events for one shipment stay
 * on one partition in the order they were written.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;
    String aggregateId;
    String eventType;
    String payload;
    String correlationId;
    Instant createdAt;
    Instant publishedAt;
    int retryCount;
    String lastError;
    Long sequenceNumber;

    public static OutboxEvent create(String aggregateType, String aggregateId,
                                     String eventType, String payload, String correlationId) {
        return new OutboxEvent(
            UUID.randomUUID(),
            aggregateType,
            aggregateId,
            eventType,
            payload,
            correlationId,
            Instant.now(),
            null,
            0,
            null,
            null   // assigned by the database
        );
    }

    public boolean isPublished() {
        return publishedAt != null;
    }

    public boolean isDeadLettered(int maxRetries) {
        return !isPublished() && retryCount >= maxRetries;
    }
}

package com.flagship.trade_finance.consumer;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for processed_events. One row per (event, consumer group).
 */
@Entity
@Table(
    name = "processed_events",
    uniqueConstraints = @UniqueConstraint(name = "uq_processed_events_event_group",
            columnNames = {"event_id", "consumer_group"})
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ProcessedEventEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "event_id", nullable = false, updatable = false)
    private UUID eventId;

    @Column(name = "event_type", nullable = false, length = 100)
    private String eventType;

    @Column(name = "shipment_id", nullable = false, length = 100)
    private String shipmentId;

    @Column(name = "consumer_group", nullable = false, length = 100)
    private String consumerGroup;

    @Column(name = "processed_at", nullable = false)
    private Instant processedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "processing_result", length = 50)
    private ProcessedEvent.ProcessingResult processingResult;

    @Column(name = "note", columnDefinition = "TEXT")
    private String note;

    static ProcessedEventEntity fromDomain(ProcessedEvent event) {
        return new ProcessedEventEntity(
            UUID.randomUUID(),
            event.getEventId(),
            event.getEventType(),
            event.getShipmentId(),
            event.getConsumerGroup(),
            event.getProcessedAt(),
            event.getResult(),
            event.getNote()
        );
    }

    public ProcessedEvent toDomain() {
        return new ProcessedEvent(
            eventId,
            eventType,
            shipmentId,
            consumerGroup,
            processedAt,
            processingResult,
            note
        );
    }
}

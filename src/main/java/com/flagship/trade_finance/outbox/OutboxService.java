package com.flagship.trade_finance.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.trade_finance.observability.CorrelationContext;
import com.flagship.trade_finance.trade.event.ShipmentEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Writes shipment events to the outbox.
 *
 * {@link #saveEvent} joins the caller's transaction: if the action record
 * commits, its event commits with it; if it rolls back, so does the event.
 * Publishing to Kafka is left to {@link OutboxPublisher}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OutboxService {

    static final String AGGREGATE_TYPE = "Shipment";

    private final OutboxEventRepository repository;
    private final ObjectMapper objectMapper;

    /**
     * Saves an event within the current transaction.
     *
     * @throws org.springframework.transaction.IllegalTransactionStateException
     *         if no transaction is active
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public OutboxEvent saveEvent(ShipmentEvent event) {
        OutboxEvent outboxEvent = OutboxEvent.create(
                AGGREGATE_TYPE,
                event.getShipmentId(),
                event.getEventType(),
                serializePayload(event),
                CorrelationContext.getCorrelationId());

        OutboxEventEntity saved = repository.save(OutboxEventEntity.fromDomain(outboxEvent));

        log.debug("Saved outbox event: type={}, shipmentId={}", event.getEventType(), event.getShipmentId());
        return saved.toDomain();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public List<OutboxEvent> findPublishableEvents(int limit, int maxRetries) {
        return repository.findPublishableForUpdate(limit, maxRetries)
                .stream()
                .map(OutboxEventEntity::toDomain)
                .toList();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markPublished(UUID eventId) {
        repository.findById(eventId).ifPresent(entity -> {
            entity.markPublished();
            repository.save(entity);
            log.debug("Marked event {} as published", eventId);
        });
    }

    /**
     * Records a failed publish attempt.
     *
     * @return the retry count after this failure, or 0 if the event is gone
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public int markFailed(UUID eventId, String errorMessage) {
        return repository.findById(eventId).map(entity -> {
            entity.markFailed(errorMessage);
            repository.save(entity);
            log.warn("Marked event {} as failed (retry #{}): {}",
                    eventId, entity.getRetryCount(), errorMessage);
            return entity.getRetryCount();
        }).orElse(0);
    }

    @Transactional(readOnly = true)
    public List<OutboxEvent> getEventsForShipment(String shipmentId) {
        return repository.findByAggregateIdOrderBySequenceNumberAsc(shipmentId)
                .stream()
                .map(OutboxEventEntity::toDomain)
                .toList();
    }

    @Transactional(readOnly = true)
    public long countUnpublished() {
        return repository.countUnpublished();
    }

    private String serializePayload(ShipmentEvent event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize event payload", e);
        }
    }
}

package com.flagship.trade_finance.consumer;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.trade_finance.lifecycle.LifecycleIntegrityException;
import com.flagship.trade_finance.observability.CorrelationContext;
import com.flagship.trade_finance.outbox.OutboxPublisher;
import com.flagship.trade_finance.reconcile.BalanceReconciler;
import com.flagship.trade_finance.trade.event.ShipmentActionConfirmedEvent;
import com.flagship.trade_finance.trade.event.ShipmentRegisteredEvent;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.header.Header;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.UUID;

/**
 * Keeps this instance's shipment cache in step with actions confirmed anywhere.
 *
 * Every confirmed action and registration triggers a refresh of the shipment
 * it names. Offsets are committed manually after handling; a failed refresh
 * leaves the offset uncommitted so the event is redelivered. Each instance
 * needs its own {@code consumer.group-id} to see every event.
 */
@Component
@ConditionalOnProperty(name = "consumer.enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class ShipmentEventConsumer {

    private final IdempotentEventProcessor eventProcessor;
    private final BalanceReconciler reconciler;
    private final ObjectMapper objectMapper;
    private final String consumerGroup;

    public ShipmentEventConsumer(IdempotentEventProcessor eventProcessor,
                                 BalanceReconciler reconciler,
                                 ObjectMapper objectMapper,
                                 @Value("${consumer.group-id:trade-finance-cache}") String consumerGroup) {
        this.eventProcessor = eventProcessor;
        this.reconciler = reconciler;
        this.objectMapper = objectMapper;
        this.consumerGroup = consumerGroup;
    }

    @KafkaListener(
        topics = "${kafka.topic.shipments:shipments}",
        groupId = "${consumer.group-id:trade-finance-cache}"
    )
    public void consume(ConsumerRecord<String, String> record, Acknowledgment ack) {
        String correlationId = headerValue(record, CorrelationContext.CORRELATION_ID_HEADER);
        CorrelationContext.setCorrelationId(correlationId);
        MDC.put(CorrelationContext.CORRELATION_ID_MDC_KEY, CorrelationContext.getCorrelationId());
        try {
            log.debug("Received message: topic={}, partition={}, offset={}, key={}",
                    record.topic(), record.partition(), record.offset(), record.key());

            EventEnvelope envelope = parseEvent(record);
            if (envelope == null) {
                log.warn("Could not parse event at offset {}, acknowledging to skip", record.offset());
                ack.acknowledge();
                return;
            }

            handle(envelope);
            ack.acknowledge();

        } finally {
            MDC.remove(CorrelationContext.CORRELATION_ID_MDC_KEY);
            CorrelationContext.clear();
        }
    }

    void handle(EventEnvelope envelope) {
        switch (envelope.eventType()) {
            case ShipmentActionConfirmedEvent.EVENT_TYPE, ShipmentRegisteredEvent.EVENT_TYPE -> refresh(envelope);
            default -> eventProcessor.skipEvent(envelope.eventId(), envelope.eventType(),
                    envelope.shipmentId(), consumerGroup, "Unknown event type");
        }
    }

    private void refresh(EventEnvelope envelope) {
        try {
            boolean processed = eventProcessor.processEvent(envelope.eventId(), envelope.eventType(),
                    envelope.shipmentId(), consumerGroup, () -> reconciler.refresh(envelope.shipmentId()));
            if (processed) {
                log.info("Processed event: type={}, eventId={}, shipmentId={}",
                        envelope.eventType(), envelope.eventId(), envelope.shipmentId());
            }
        } catch (LifecycleIntegrityException e) {
            // Redelivery cannot fix bad ledger data; the periodic refresh keeps reporting it
            eventProcessor.skipEvent(envelope.eventId(), envelope.eventType(), envelope.shipmentId(),
                    consumerGroup, "Lifecycle integrity violation: " + e.getMessage());
        }
    }

    private EventEnvelope parseEvent(ConsumerRecord<String, String> record) {
        try {
            JsonNode node = objectMapper.readTree(record.value());
            UUID eventId = UUID.fromString(node.get("eventId").asText());
            String shipmentId = node.hasNonNull("shipmentId") ? node.get("shipmentId").asText() : record.key();
            String eventType = headerValue(record, OutboxPublisher.EVENT_TYPE_HEADER);
            if (eventType == null) {
                eventType = node.hasNonNull("eventType") ? node.get("eventType").asText() : "Unknown";
            }
            if (shipmentId == null) {
                return null;
            }
            return new EventEnvelope(eventId, shipmentId, eventType);
        } catch (Exception e) {
            log.error("Failed to parse event envelope: {}", e.getMessage());
            return null;
        }
    }

    private static String headerValue(ConsumerRecord<String, String> record, String name) {
        Header header = record.headers().lastHeader(name);
        return header != null ? new String(header.value(), StandardCharsets.UTF_8) : null;
    }

    record EventEnvelope(UUID eventId, String shipmentId, String eventType) {}
}

package com.flagship.trade_finance.consumer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.trade_finance.lifecycle.LifecycleIntegrityException;
import com.flagship.trade_finance.outbox.OutboxPublisher;
import com.flagship.trade_finance.reconcile.BalanceReconciler;
import com.flagship.trade_finance.trade.event.ShipmentActionConfirmedEvent;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.kafka.support.Acknowledgment;

import java.nio.charset.StandardCharsets;
import java.util.UUID;

import static com.flagship.trade_finance.support.Shipments.HASH;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ShipmentEventConsumerTest {

    private static final String GROUP = "cache-test";

    private IdempotentEventProcessor processor;
    private BalanceReconciler reconciler;
    private Acknowledgment ack;
    private ShipmentEventConsumer consumer;

    @BeforeEach
    void setUp() {
        processor = mock(IdempotentEventProcessor.class);
        reconciler = mock(BalanceReconciler.class);
        ack = mock(Acknowledgment.class);
        consumer = new ShipmentEventConsumer(processor, reconciler, new ObjectMapper(), GROUP);
        when(processor.processEvent(any(), any(), any(), any(), any())).thenAnswer(invocation -> {
            Runnable handler = invocation.getArgument(4);
            handler.run();
            return true;
        });
    }

    private static ConsumerRecord<String, String> record(String key, String value, String eventType) {
        ConsumerRecord<String, String> record = new ConsumerRecord<>("shipments", 0, 42L, key, value);
        if (eventType != null) {
            record.headers().add(OutboxPublisher.EVENT_TYPE_HEADER, eventType.getBytes(StandardCharsets.UTF_8));
        }
        record.headers().add("X-Correlation-ID", "corr-123".getBytes(StandardCharsets.UTF_8));
        return record;
    }

    private static String payload(UUID eventId, String shipmentId) {
        return shipmentId == null
                ? String.format("{\"eventId\":\"%s\"}", eventId)
                : String.format("{\"eventId\":\"%s\",\"shipmentId\":\"%s\"}", eventId, shipmentId);
    }

    @Test
    @DisplayName("A confirmed action refreshes the shipment and commits the offset")
    void confirmedActionRefreshes() {
        UUID eventId = UUID.randomUUID();

        consumer.consume(record(HASH, payload(eventId, HASH), ShipmentActionConfirmedEvent.EVENT_TYPE), ack);

        verify(processor).processEvent(eq(eventId), eq(ShipmentActionConfirmedEvent.EVENT_TYPE), eq(HASH),
                eq(GROUP), any());
        verify(reconciler).refresh(HASH);
        verify(ack).acknowledge();
    }

    @Test
    @DisplayName("The record key stands in for a missing shipment id")
    void keyFallback() {
        consumer.consume(record(HASH, payload(UUID.randomUUID(), null), "ShipmentRegistered"), ack);

        verify(reconciler).refresh(HASH);
    }

    @Test
    @DisplayName("Unknown event types are recorded as skipped")
    void unknownTypeSkipped() {
        UUID eventId = UUID.randomUUID();

        consumer.consume(record(HASH, payload(eventId, HASH), "ShipmentRenamed"), ack);

        verify(processor).skipEvent(eventId, "ShipmentRenamed", HASH, GROUP, "Unknown event type");
        verify(reconciler, never()).refresh(anyString());
        verify(ack).acknowledge();
    }

    @Test
    @DisplayName("An unparseable message is acknowledged and dropped")
    void unparseableDropped() {
        consumer.consume(record(HASH, "not json", ShipmentActionConfirmedEvent.EVENT_TYPE), ack);

        verify(processor, never()).processEvent(any(), any(), any(), any(), any());
        verify(ack).acknowledge();
    }

    @Test
    @DisplayName("Integrity violations are skipped instead of redelivered")
    void integrityViolationSkipped() {
        UUID eventId = UUID.randomUUID();
        when(reconciler.refresh(HASH)).thenThrow(new LifecycleIntegrityException(HASH, "stage regressed"));

        consumer.consume(record(HASH, payload(eventId, HASH), ShipmentActionConfirmedEvent.EVENT_TYPE), ack);

        verify(processor).skipEvent(eq(eventId), eq(ShipmentActionConfirmedEvent.EVENT_TYPE), eq(HASH), eq(GROUP),
                startsWith("Lifecycle integrity violation"));
        verify(ack).acknowledge();
    }

    @Test
    @DisplayName("Other handler failures leave the offset uncommitted")
    void failureNotAcknowledged() {
        when(reconciler.refresh(HASH)).thenThrow(new IllegalStateException("cache busy"));

        assertThrows(IllegalStateException.class, () -> consumer.consume(
                record(HASH, payload(UUID.randomUUID(), HASH), ShipmentActionConfirmedEvent.EVENT_TYPE), ack));

        verify(ack, never()).acknowledge();
    }
}

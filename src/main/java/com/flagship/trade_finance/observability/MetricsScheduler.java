package com.flagship.trade_finance.observability;

import com.flagship.trade_finance.reconcile.ShipmentStateStore;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Refreshes gauges that need a database query, and registers the cache-size
 * gauge for the shipment state store.
 */
@Component
@RequiredArgsConstructor
public class MetricsScheduler {

    private final OutboxMetrics outboxMetrics;
    private final ShipmentStateStore stateStore;
    private final MeterRegistry meterRegistry;

    @PostConstruct
    public void registerCacheGauge() {
        Gauge.builder("reconciler.cache.size", stateStore, ShipmentStateStore::size)
                .description("Shipments held in the in-memory state store")
                .register(meterRegistry);
    }

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    public void refreshOutboxMetrics() {
        outboxMetrics.refreshMetrics();
    }
}

package com.flagship.trade_finance.observability;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Metrics for orchestrated actions and cache refreshes.
 *
 * Metrics exposed:
 * - actions.submitted{action,outcome}: orchestrated actions by final outcome
 * - actions.latency{action}: end-to-end action duration
 * - actions.rejected{action,kind}: precondition and ledger rejections by kind
 * - ledger.retries{action}: automatic retries after an ordering conflict
 * - reconciler.refresh{result}: cache refresh results
 * - idempotency.cache{result}: repeated vs new action requests
 */
@Component
public class ActionMetrics {

    private final MeterRegistry registry;

    public ActionMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordActionOutcome(String action, String outcome) {
        registry.counter("actions.submitted",
                "action", sanitizeTag(action),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordActionLatency(String action, long durationMs) {
        registry.timer("actions.latency",
                "action", sanitizeTag(action)
        ).record(Duration.ofMillis(durationMs));
    }

    public void recordRejected(String action, String kind) {
        registry.counter("actions.rejected",
                "action", sanitizeTag(action),
                "kind", sanitizeTag(kind)
        ).increment();
    }

    public void recordRetry(String action) {
        registry.counter("ledger.retries", "action", sanitizeTag(action)).increment();
    }

    public void recordRefresh(String result) {
        registry.counter("reconciler.refresh", "result", sanitizeTag(result)).increment();
    }

    public void recordIdempotencyHit() {
        registry.counter("idempotency.cache", "result", "hit").increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("idempotency.cache", "result", "miss").increment();
    }

    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}

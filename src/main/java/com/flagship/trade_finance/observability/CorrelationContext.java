package com.flagship.trade_finance.observability;

import org.slf4j.MDC;

import java.util.UUID;
import java.util.function.Supplier;

/**
 * Thread-local correlation ID plus the MDC keys used across the service.
 *
 * The correlation ID arrives on the X-Correlation-ID header (or is generated),
 * is forwarded on calls to the ledger gateway and query service, travels as a
 * Kafka header on published events and appears in every log line via MDC.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String SHIPMENT_ID_MDC_KEY = "shipmentId";
    public static final String ACCOUNT_ID_MDC_KEY = "accountId";

    private static final ThreadLocal<String> correlationId = new ThreadLocal<>();

    private CorrelationContext() {
    }

    /**
     * Gets the current correlation ID, generating one if none is set.
     */
    public static String getCorrelationId() {
        String id = correlationId.get();
        if (id == null) {
            id = generateCorrelationId();
            correlationId.set(id);
        }
        return id;
    }

    public static void setCorrelationId(String id) {
        if (id != null && !id.isBlank()) {
            correlationId.set(id);
        } else {
            correlationId.set(generateCorrelationId());
        }
    }

    public static void clear() {
        correlationId.remove();
    }

    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    public static boolean hasCorrelationId() {
        return correlationId.get() != null;
    }

    /**
     * Copies the correlation ID of the calling thread onto the thread that
     * runs the task, so sequenced tasks log under the request that queued them.
     * The worker's previous ID is restored afterwards.
     */
    public static <T> Supplier<T> propagate(Supplier<T> task) {
        String captured = correlationId.get();
        return () -> {
            String previous = correlationId.get();
            apply(captured);
            try {
                return task.get();
            } finally {
                apply(previous);
            }
        };
    }

    private static void apply(String id) {
        if (id != null) {
            correlationId.set(id);
            MDC.put(CORRELATION_ID_MDC_KEY, id);
        } else {
            correlationId.remove();
            MDC.remove(CORRELATION_ID_MDC_KEY);
        }
    }

    /**
     * Puts shipment and account into the MDC for the duration of an action.
     * Callers remove them with {@link #clearActionContext()} in a finally block.
     */
    public static void putActionContext(String shipmentId, String accountId) {
        if (shipmentId != null) {
            MDC.put(SHIPMENT_ID_MDC_KEY, shipmentId);
        }
        if (accountId != null) {
            MDC.put(ACCOUNT_ID_MDC_KEY, accountId);
        }
    }

    public static void clearActionContext() {
        MDC.remove(SHIPMENT_ID_MDC_KEY);
        MDC.remove(ACCOUNT_ID_MDC_KEY);
    }
}

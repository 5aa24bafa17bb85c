package com.flagship.toy_banking.observability;

import org.slf4j.MDC;

import java.util.UUID;
import java.util.function.Supplier;

/**
 * Thread-local correlation id plus the MDC keys printed by the log pattern.
 *
 * The correlation id arrives with each HTTP request (or is generated); the transfer id is
 * set while the coordinator or participant works on one transfer.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String TRANSFER_ID_MDC_KEY = "transferId";

    private static final ThreadLocal<String> correlationId = new ThreadLocal<>();

    private CorrelationContext() {
        // Utility class
    }

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

    /**
     * Short format for readability in logs.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    /**
     * Runs the action with {@code transferId} in the MDC, restoring the previous value after.
     * Nested calls (a loopback transfer where origin and destination share the thread's
     * request) keep the outer value intact.
     */
    public static <T> T withTransferId(Object transferId, Supplier<T> action) {
        String previous = MDC.get(TRANSFER_ID_MDC_KEY);
        MDC.put(TRANSFER_ID_MDC_KEY, String.valueOf(transferId));
        try {
            return action.get();
        } finally {
            if (previous != null) {
                MDC.put(TRANSFER_ID_MDC_KEY, previous);
            } else {
                MDC.remove(TRANSFER_ID_MDC_KEY);
            }
        }
    }
}

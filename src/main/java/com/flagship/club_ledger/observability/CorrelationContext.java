package com.flagship.club_ledger.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Thread-local correlation id plus the MDC keys used across the ledger.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String EVENT_ID_MDC_KEY = "eventId";
    public static final String EVENT_TYPE_MDC_KEY = "eventType";
    public static final String PAYMENT_INTENT_MDC_KEY = "paymentIntentId";
    public static final String TRANSACTION_ID_MDC_KEY = "transactionId";

    private static final ThreadLocal<String> correlationId = new ThreadLocal<>();

    private CorrelationContext() {
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

    /** Short form for readable logs. */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    /**
     * Tags log lines with the processor event being handled.
     */
    public static void putEvent(String eventId, String eventType) {
        MDC.put(EVENT_ID_MDC_KEY, eventId);
        MDC.put(EVENT_TYPE_MDC_KEY, eventType);
    }

    public static void clearEvent() {
        MDC.remove(EVENT_ID_MDC_KEY);
        MDC.remove(EVENT_TYPE_MDC_KEY);
        MDC.remove(PAYMENT_INTENT_MDC_KEY);
        MDC.remove(TRANSACTION_ID_MDC_KEY);
    }
}

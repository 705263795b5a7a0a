package com.flagship.club_ledger.processor;

import java.util.Map;

/**
 * Completed checkout session as reported on the initiation notification.
 */
public record CheckoutSessionSnapshot(
        String sessionId,
        String paymentIntentId,
        String paymentStatus,
        long amountTotal,
        String currency,
        Map<String, String> metadata) implements EventPayload {

    public static final String PAID = "paid";

    public CheckoutSessionSnapshot {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public boolean isPaid() {
        return PAID.equals(paymentStatus);
    }
}

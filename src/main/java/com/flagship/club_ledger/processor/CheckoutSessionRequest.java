package com.flagship.club_ledger.processor;

import java.util.Map;

/**
 * Everything the processor needs to open a hosted checkout that pays a
 * receiving account and routes {@code applicationFee} to the platform.
 */
public record CheckoutSessionRequest(
        String receivingAccountRef,
        String itemName,
        String itemDescription,
        long amount,
        String currency,
        long applicationFee,
        String customerEmail,
        String successUrl,
        String cancelUrl,
        Map<String, String> metadata) {

    public CheckoutSessionRequest {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }
}

package com.flagship.club_ledger.processor;

import java.util.Map;

public record PaymentIntentSnapshot(String paymentIntentId, long amount, String currency,
                                    Map<String, String> metadata) {

    public PaymentIntentSnapshot {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }
}

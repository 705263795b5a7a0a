package com.flagship.club_ledger.processor;

public record CheckoutSessionHandle(String sessionId, String url) {
}

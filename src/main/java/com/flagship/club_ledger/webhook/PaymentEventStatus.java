package com.flagship.club_ledger.webhook;

public enum PaymentEventStatus {
    /** Claimed, handler running or crashed mid-way. */
    PROCESSING,
    COMPLETED,
    FAILED
}

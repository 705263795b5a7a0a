package com.flagship.club_ledger.processor;

import java.time.Instant;
import java.util.Set;

/**
 * One movement on a receiving account's processor balance.
 *
 * {@code sourceId} is the charge or refund that caused it, when there is one.
 */
public record BalanceEntry(
        String id,
        String type,
        long amount,
        long fee,
        long net,
        String sourceId,
        Instant createdAt) {

    private static final Set<String> PAYMENT_TYPES = Set.of("charge", "payment", "refund");

    /** Charges, payments and refunds; payouts, fees and adjustments are not ledger rows. */
    public boolean isLedgerMovement() {
        return PAYMENT_TYPES.contains(type);
    }
}

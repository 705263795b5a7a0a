package com.flagship.club_ledger.processor;

import java.time.Instant;

/**
 * A charge as listed or retrieved from the processor, with the status and
 * creation time that notifications do not carry.
 */
public record ProcessorCharge(
        ChargeSnapshot charge,
        String status,
        boolean livemode,
        Instant createdAt) {

    public static final String SUCCEEDED = "succeeded";

    public String chargeId() {
        return charge.chargeId();
    }

    public long amount() {
        return charge.amount();
    }

    public boolean isSucceeded() {
        return SUCCEEDED.equals(status);
    }

    /** Succeeded and not fully refunded. */
    public boolean isSettledPayment() {
        return isSucceeded() && !charge.refunded();
    }
}

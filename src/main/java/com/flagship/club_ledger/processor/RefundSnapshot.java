package com.flagship.club_ledger.processor;

/**
 * A refund object attached to a charge.
 */
public record RefundSnapshot(String refundId, long amount, String status) {

    public boolean isFailed() {
        return "failed".equals(status) || "canceled".equals(status);
    }
}

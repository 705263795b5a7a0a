package com.flagship.club_ledger.notification;

import com.flagship.club_ledger.transaction.FinancialTransaction;

import java.time.Instant;
import java.util.UUID;

/**
 * Refund confirmation. {@code amount} is positive: what the payer gets back.
 */
public record RefundReceipt(
        UUID refundTransactionId,
        UUID paymentTransactionId,
        String organizerRef,
        String payerRef,
        String payerName,
        String payerEmail,
        long amount,
        String currency,
        String referenceName,
        String reason,
        Instant refundedAt) {

    public static RefundReceipt from(FinancialTransaction refund, FinancialTransaction payment) {
        return new RefundReceipt(
                refund.getId(),
                payment.getId(),
                payment.getOrganizerRef(),
                payment.getPayerRef(),
                payment.getPayerName(),
                payment.getPayerEmail(),
                Math.abs(refund.getAmount()),
                refund.getCurrency(),
                payment.getReferenceName(),
                refund.getRefundReason(),
                refund.getCompletedAt());
    }
}

package com.flagship.club_ledger.refund;

import com.flagship.club_ledger.transaction.TransactionStatus;

import java.util.UUID;

/**
 * Outcome of an operator refund. {@code refundId} is the processor's id.
 */
public record RefundResult(String refundId, UUID refundTransactionId, UUID paymentTransactionId,
                           long amount, TransactionStatus status) {
}

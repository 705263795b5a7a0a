package com.flagship.club_ledger.transaction;

/**
 * Status of a ledger row. Which values are reachable depends on the
 * {@link TransactionKind}; see {@link FinancialTransaction#canTransitionTo}.
 */
public enum TransactionStatus {
    /** Provisional: payment initiated or refund requested, settlement not yet seen. */
    PROCESSING,
    COMPLETED,
    REFUNDED,
    PARTIALLY_REFUNDED,
    /** Payment has an open chargeback against it. */
    DISPUTED,
    DISPUTE_LOST,
    FAILED,

    // Dispute rows
    OPEN,
    WON,
    LOST,
    /** Dispute closed for a reason other than won or lost. */
    CLOSED
}

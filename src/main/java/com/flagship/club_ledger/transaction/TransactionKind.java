package com.flagship.club_ledger.transaction;

public enum TransactionKind {
    PAYMENT,
    REFUND,
    DISPUTE
}

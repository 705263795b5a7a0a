package com.flagship.club_ledger.feelock;

public enum AccountFeeLockStatus {
    /** A checkout carrying the fee was started. */
    CLAIMED,
    /** That checkout was paid. */
    CONFIRMED
}

package com.flagship.club_ledger.reconciliation;

public enum ReconciliationMode {
    /** Settled charges against PAYMENT rows by charge id and gross. */
    CHARGES,
    /** Balance movements against ledger rows by settlement, charge or refund id and net. */
    SETTLEMENTS
}

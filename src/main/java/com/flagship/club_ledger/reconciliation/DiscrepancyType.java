package com.flagship.club_ledger.reconciliation;

import java.util.Locale;

/**
 * Ways the ledger and the processor's records for an account can disagree.
 */
public enum DiscrepancyType {
    /** The processor has a settled charge or balance movement the ledger never recorded. */
    MISSING_IN_LEDGER,
    /** The ledger has a settled row the processor does not list for the window. */
    MISSING_IN_PROCESSOR,
    AMOUNT_MISMATCH,
    /** The charge is recorded, but against a different receiving account. */
    ACCOUNT_MISMATCH;

    public String metricField() {
        return name().toLowerCase(Locale.ROOT);
    }
}

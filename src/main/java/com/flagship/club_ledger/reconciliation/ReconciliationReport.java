package com.flagship.club_ledger.reconciliation;

import java.time.Instant;
import java.util.List;

public record ReconciliationReport(
        ReconciliationMode mode,
        String receivingAccountRef,
        Instant from,
        Instant to,
        ReconciliationSummary summary,
        List<Discrepancy> discrepancies,
        Instant runAt) {

    public boolean isClean() {
        return discrepancies.isEmpty();
    }
}

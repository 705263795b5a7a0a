package com.flagship.club_ledger.reconciliation;

import java.util.Map;

/**
 * Totals for one run. {@code compared} excludes ignored balance entries;
 * {@code matchRate} is a percentage with one decimal, 100 when nothing was compared.
 */
public record ReconciliationSummary(
        long processorTotal,
        long ledgerTotal,
        long difference,
        int compared,
        int matched,
        int missingInLedger,
        int missingInProcessor,
        int amountMismatches,
        int accountMismatches,
        int ignored,
        Map<String, Integer> ignoredTypes,
        double matchRate) {
}

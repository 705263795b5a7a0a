package com.flagship.club_ledger.reconciliation;

import java.time.Instant;
import java.util.UUID;

/**
 * One disagreement found by a reconciliation run.
 *
 * {@code processorRef} is the charge id for charge runs and the balance entry
 * id for settlement runs; {@code sourceRef} is the charge or refund behind a
 * balance entry. Amounts are null on the side that has no record.
 * {@code recordedAccountRef} is only set for {@link DiscrepancyType#ACCOUNT_MISMATCH}.
 */
public record Discrepancy(
        DiscrepancyType type,
        String processorRef,
        String sourceRef,
        UUID transactionId,
        Long processorAmount,
        Long ledgerAmount,
        Long difference,
        Instant occurredAt,
        String description,
        boolean canAutoFix,
        String recordedAccountRef) {

    static Discrepancy missingInLedger(String processorRef, String sourceRef, long processorAmount,
                                       Instant occurredAt, String description, boolean canAutoFix) {
        return new Discrepancy(DiscrepancyType.MISSING_IN_LEDGER, processorRef, sourceRef, null,
                processorAmount, null, processorAmount, occurredAt, description, canAutoFix, null);
    }

    static Discrepancy missingInProcessor(String processorRef, UUID transactionId, long ledgerAmount,
                                          Instant occurredAt, String description) {
        return new Discrepancy(DiscrepancyType.MISSING_IN_PROCESSOR, processorRef, null, transactionId,
                null, ledgerAmount, -ledgerAmount, occurredAt, description, false, null);
    }

    static Discrepancy amountMismatch(String processorRef, String sourceRef, UUID transactionId,
                                      long processorAmount, long ledgerAmount, Instant occurredAt) {
        return new Discrepancy(DiscrepancyType.AMOUNT_MISMATCH, processorRef, sourceRef, transactionId,
                processorAmount, ledgerAmount, processorAmount - ledgerAmount, occurredAt,
                String.format("Processor amount %d differs from ledger amount %d", processorAmount, ledgerAmount),
                false, null);
    }

    static Discrepancy accountMismatch(String chargeId, UUID transactionId, long amount,
                                       Instant occurredAt, String recordedAccountRef) {
        return new Discrepancy(DiscrepancyType.ACCOUNT_MISMATCH, chargeId, null, transactionId,
                amount, amount, 0L, occurredAt,
                "Charge is recorded against receiving account " + recordedAccountRef,
                false, recordedAccountRef);
    }
}

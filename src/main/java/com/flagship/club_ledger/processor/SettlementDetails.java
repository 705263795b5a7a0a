package com.flagship.club_ledger.processor;

/**
 * The processor's authoritative record of what moved for a charge.
 *
 * {@code totalFee} covers processing and platform fees together and
 * {@code netAmount} is what reached the receiving account.
 * {@code applicationFee} is the platform's share as the processor recorded it.
 */
public record SettlementDetails(
        String settlementId,
        long grossAmount,
        long totalFee,
        long netAmount,
        long applicationFee) {
}

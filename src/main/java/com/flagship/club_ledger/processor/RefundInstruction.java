package com.flagship.club_ledger.processor;

/**
 * Request to refund part or all of a charge on a receiving account.
 */
public record RefundInstruction(String chargeId, String receivingAccountRef, long amount, String reason) {
}

package com.flagship.club_ledger.processor;

import java.time.Instant;

/**
 * Chargeback object carried on dispute notifications.
 */
public record DisputeSnapshot(
        String disputeId,
        String chargeId,
        long amount,
        String status,
        String reason,
        Instant evidenceDueBy) implements EventPayload {

    public static final String WON = "won";
    public static final String LOST = "lost";
}

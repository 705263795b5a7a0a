package com.flagship.club_ledger.webhook;

import lombok.Value;

import java.time.Instant;

/**
 * Claim record for one inbound processor notification.
 */
@Value
public class PaymentEventRecord {
    String id;
    String type;
    PaymentEventStatus status;
    Instant claimedAt;
    Instant completedAt;
    Instant failedAt;
    String error;
    int attempts;

    public boolean isStuck(Instant cutoff) {
        return status == PaymentEventStatus.PROCESSING && claimedAt.isBefore(cutoff);
    }
}

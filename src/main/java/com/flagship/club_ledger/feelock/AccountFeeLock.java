package com.flagship.club_ledger.feelock;

import java.time.Instant;

public record AccountFeeLock(
        String accountRef,
        String periodKey,
        String lockId,
        AccountFeeLockStatus status,
        Instant claimedAt,
        Instant expiresAt,
        Instant confirmedAt) {
}

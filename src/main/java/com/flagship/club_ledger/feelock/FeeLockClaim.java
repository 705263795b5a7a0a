package com.flagship.club_ledger.feelock;

/**
 * Result of {@link AccountFeeLockService#tryClaim}. When {@code shouldCharge}
 * is true the caller adds the account fee and records {@code lockId} in the
 * checkout metadata; otherwise {@code lockId} names the lock already held.
 */
public record FeeLockClaim(boolean shouldCharge, String lockId, String periodKey, boolean rollover) {

    public static FeeLockClaim notCharged(String periodKey) {
        return new FeeLockClaim(false, null, periodKey, false);
    }
}

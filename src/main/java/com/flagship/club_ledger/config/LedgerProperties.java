package com.flagship.club_ledger.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.ZoneId;

/**
 * Tunables for fee calculation, the account fee lock, the idempotency gate and
 * reconciliation runs.
 * Bound from the {@code ledger.*} namespace.
 */
@ConfigurationProperties(prefix = "ledger")
@Getter
@Setter
public class LedgerProperties {

    private final Fees fees = new Fees();
    private final FeeLock feeLock = new FeeLock();
    private final Idempotency idempotency = new Idempotency();
    private final Reconciliation reconciliation = new Reconciliation();

    @Getter
    @Setter
    public static class Fees {
        /** Platform share of each checkout, as a fraction (0.015 = 1.5%). */
        private BigDecimal platformRate = new BigDecimal("0.015");

        /** Recurring per-account platform charge, minor units. */
        private long accountFee = 200;

        /** Checkouts below this amount never carry the account fee. */
        private long accountFeeMinimumPayment = 1000;
    }

    @Getter
    @Setter
    public static class FeeLock {
        /** How long an unconfirmed lock blocks other checkouts. Zero disables rollover. */
        private Duration ttl = Duration.ofHours(24);

        /** Zone used to derive the billing period key. */
        private ZoneId zone = ZoneId.of("UTC");
    }

    @Getter
    @Setter
    public static class Idempotency {
        /** Unset keeps claims permanent. */
        private Duration staleClaimExpiry;

        private boolean redisFastPath = true;

        private Duration redisTtl = Duration.ofDays(7);

        /** A PROCESSING claim older than this is reported as stuck. */
        private Duration stuckAfter = Duration.ofMinutes(15);

        public boolean isStaleClaimExpiryEnabled() {
            return staleClaimExpiry != null && !staleClaimExpiry.isZero() && !staleClaimExpiry.isNegative();
        }
    }

    @Getter
    @Setter
    public static class Reconciliation {
        /** Longest window one run may cover. */
        private Duration maxRange = Duration.ofDays(90);

        /** Differences up to this many minor units count as matched. */
        private long amountTolerance = 1;
    }
}

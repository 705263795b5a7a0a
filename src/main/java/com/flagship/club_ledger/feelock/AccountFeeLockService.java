package com.flagship.club_ledger.feelock;

import com.flagship.club_ledger.config.LedgerProperties;
import com.flagship.club_ledger.observability.LedgerMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.YearMonth;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Ensures the recurring account fee is added to at most one checkout per
 * receiving account and billing period.
 *
 * Each (account, period) key has one row. The first checkout inserts it and
 * charges. While the lock is unconfirmed and unexpired, other checkouts do not
 * charge. Once its {@code expiresAt} passes without a paid initiation, the
 * next checkout takes it over with a fresh lock id.
 */
@Service
@Slf4j
public class AccountFeeLockService {

    private static final String INSERT_SQL = """
        INSERT INTO account_fee_locks (account_ref, period_key, lock_id, status, claimed_at, expires_at)
        VALUES (?, ?, ?, 'CLAIMED', ?, ?)
        ON CONFLICT (account_ref, period_key) DO NOTHING
        """;

    private static final String ROLLOVER_SQL = """
        UPDATE account_fee_locks
        SET lock_id = ?, claimed_at = ?, expires_at = ?
        WHERE account_ref = ? AND period_key = ?
        AND status = 'CLAIMED' AND expires_at IS NOT NULL AND expires_at < ?
        """;

    private static final String CONFIRM_SQL = """
        UPDATE account_fee_locks
        SET status = 'CONFIRMED', confirmed_at = ?
        WHERE lock_id = ? AND status = 'CLAIMED'
        """;

    private static final String SELECT_BY_KEY_SQL = """
        SELECT account_ref, period_key, lock_id, status, claimed_at, expires_at, confirmed_at
        FROM account_fee_locks WHERE account_ref = ? AND period_key = ?
        """;

    private static final String SELECT_BY_LOCK_SQL = """
        SELECT account_ref, period_key, lock_id, status, claimed_at, expires_at, confirmed_at
        FROM account_fee_locks WHERE lock_id = ?
        """;

    private static final RowMapper<AccountFeeLock> LOCK_MAPPER = (rs, rowNum) -> new AccountFeeLock(
            rs.getString("account_ref"),
            rs.getString("period_key"),
            rs.getString("lock_id"),
            AccountFeeLockStatus.valueOf(rs.getString("status")),
            toInstant(rs.getTimestamp("claimed_at")),
            toInstant(rs.getTimestamp("expires_at")),
            toInstant(rs.getTimestamp("confirmed_at")));

    private final JdbcTemplate jdbcTemplate;
    private final LedgerProperties.FeeLock settings;
    private final LedgerMetrics metrics;
    private final Clock clock;

    public AccountFeeLockService(JdbcTemplate jdbcTemplate, LedgerProperties properties,
                                 LedgerMetrics metrics, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.settings = properties.getFeeLock();
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Attempts to take the account fee lock for a billing period. Commits on
     * its own so that concurrent checkouts see the result immediately.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public FeeLockClaim tryClaim(String accountRef, String periodKey) {
        if (accountRef == null || accountRef.isBlank()) {
            throw new IllegalArgumentException("accountRef is required");
        }
        Instant now = clock.instant();
        Timestamp expiresAt = expiryFrom(now);
        String lockId = UUID.randomUUID().toString();

        int inserted = jdbcTemplate.update(INSERT_SQL,
                accountRef, periodKey, UUID.fromString(lockId), Timestamp.from(now), expiresAt);
        if (inserted == 1) {
            log.info("Account fee lock {} claimed for {} period {}", lockId, accountRef, periodKey);
            metrics.recordFeeLockClaim(true, false);
            return new FeeLockClaim(true, lockId, periodKey, false);
        }

        if (isRolloverEnabled()) {
            int rolled = jdbcTemplate.update(ROLLOVER_SQL,
                    UUID.fromString(lockId), Timestamp.from(now), expiresAt,
                    accountRef, periodKey, Timestamp.from(now));
            if (rolled == 1) {
                log.info("Expired account fee lock for {} period {} taken over as {}", accountRef, periodKey, lockId);
                metrics.recordFeeLockClaim(true, true);
                return new FeeLockClaim(true, lockId, periodKey, true);
            }
        }

        String heldBy = find(accountRef, periodKey).map(AccountFeeLock::lockId).orElse(null);
        log.debug("Account fee for {} period {} already held by lock {}", accountRef, periodKey, heldBy);
        metrics.recordFeeLockClaim(false, false);
        return new FeeLockClaim(false, heldBy, periodKey, false);
    }

    public FeeLockClaim tryClaimCurrentPeriod(String accountRef) {
        return tryClaim(accountRef, currentPeriodKey());
    }

    /**
     * Marks a lock as paid for. A lock that was already confirmed is left alone.
     *
     * @return true if this call confirmed the lock
     */
    @Transactional
    public boolean confirm(String lockId) {
        UUID id;
        try {
            id = UUID.fromString(lockId);
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring malformed account fee lock id '{}'", lockId);
            return false;
        }
        int updated = jdbcTemplate.update(CONFIRM_SQL, Timestamp.from(clock.instant()), id);
        if (updated == 1) {
            log.info("Account fee lock {} confirmed", lockId);
            return true;
        }
        List<AccountFeeLock> existing = jdbcTemplate.query(SELECT_BY_LOCK_SQL, LOCK_MAPPER, id);
        if (existing.isEmpty()) {
            log.warn("Account fee lock {} no longer exists; it expired and was taken over by another checkout", lockId);
        } else {
            log.debug("Account fee lock {} already {}", lockId, existing.get(0).status());
        }
        return false;
    }

    @Transactional(readOnly = true)
    public Optional<AccountFeeLock> find(String accountRef, String periodKey) {
        return jdbcTemplate.query(SELECT_BY_KEY_SQL, LOCK_MAPPER, accountRef, periodKey).stream().findFirst();
    }

    /**
     * Billing period of the current instant, {@code yyyy-MM} in the configured zone.
     */
    public String currentPeriodKey() {
        return YearMonth.now(clock.withZone(settings.getZone())).toString();
    }

    private boolean isRolloverEnabled() {
        Duration ttl = settings.getTtl();
        return ttl != null && !ttl.isZero() && !ttl.isNegative();
    }

    private Timestamp expiryFrom(Instant now) {
        return isRolloverEnabled() ? Timestamp.from(now.plus(settings.getTtl())) : null;
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }
}

package com.flagship.club_ledger.webhook;

import com.flagship.club_ledger.config.LedgerProperties;
import com.flagship.club_ledger.observability.LedgerMetrics;
import com.flagship.club_ledger.processor.InvalidSignatureException;
import com.flagship.club_ledger.processor.ProcessorEvent;
import com.flagship.club_ledger.processor.WebhookVerifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Admits each processor event to the ledger at most once.
 *
 * The claim is a single insert-if-absent statement, so two deliveries racing on
 * the same id cannot both win. Claims are permanent unless
 * {@code ledger.idempotency.stale-claim-expiry} is set, in which case a FAILED
 * claim or a PROCESSING claim older than the expiry can be taken over by a
 * redelivery.
 *
 * Completed ids are also cached in Redis when the fast path is enabled. The
 * database stays the source of truth and Redis errors only cost the shortcut.
 */
@Service
@Slf4j
public class IdempotencyGate {

    private static final String REDIS_KEY_PREFIX = "payment-event:";
    private static final int MAX_ERROR_LENGTH = 2000;

    private static final String CLAIM_SQL = """
        INSERT INTO payment_events (id, type, status, claimed_at, attempts)
        VALUES (?, ?, 'PROCESSING', ?, 1)
        ON CONFLICT (id) DO NOTHING
        """;

    private static final String CLAIM_OR_RECLAIM_SQL = """
        INSERT INTO payment_events (id, type, status, claimed_at, attempts)
        VALUES (?, ?, 'PROCESSING', ?, 1)
        ON CONFLICT (id) DO UPDATE
        SET status = 'PROCESSING',
            claimed_at = EXCLUDED.claimed_at,
            attempts = payment_events.attempts + 1,
            error = NULL,
            failed_at = NULL
        WHERE payment_events.status = 'FAILED'
           OR (payment_events.status = 'PROCESSING' AND payment_events.claimed_at < ?)
        """;

    private final WebhookVerifier verifier;
    private final PaymentEventRepository repository;
    private final JdbcTemplate jdbcTemplate;
    private final Optional<StringRedisTemplate> redisTemplate;
    private final LedgerProperties.Idempotency settings;
    private final LedgerMetrics metrics;
    private final Clock clock;

    public IdempotencyGate(WebhookVerifier verifier,
                           PaymentEventRepository repository,
                           JdbcTemplate jdbcTemplate,
                           Optional<StringRedisTemplate> redisTemplate,
                           LedgerProperties properties,
                           LedgerMetrics metrics,
                           Clock clock) {
        this.verifier = verifier;
        this.repository = repository;
        this.jdbcTemplate = jdbcTemplate;
        this.redisTemplate = redisTemplate;
        this.settings = properties.getIdempotency();
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Authenticates a raw notification.
     *
     * @throws InvalidSignatureException on any mismatch
     */
    public ProcessorEvent verify(String payload, String signature, String sharedSecret) {
        try {
            return verifier.verify(payload, signature, sharedSecret);
        } catch (InvalidSignatureException e) {
            metrics.recordSignatureRejected();
            throw e;
        }
    }

    /**
     * Atomically claims an event id.
     *
     * @return true if this caller now owns the event, false if it was already claimed
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean claim(String eventId, String eventType) {
        if (isCachedComplete(eventId)) {
            log.info("Event {} found in completion cache, treating as duplicate", eventId);
            return false;
        }

        Instant now = clock.instant();
        int rows;
        if (settings.isStaleClaimExpiryEnabled()) {
            Instant cutoff = now.minus(settings.getStaleClaimExpiry());
            rows = jdbcTemplate.update(CLAIM_OR_RECLAIM_SQL,
                    eventId, eventType, Timestamp.from(now), Timestamp.from(cutoff));
        } else {
            rows = jdbcTemplate.update(CLAIM_SQL, eventId, eventType, Timestamp.from(now));
        }

        boolean claimed = rows == 1;
        if (claimed) {
            log.debug("Claimed event {} ({})", eventId, eventType);
        } else {
            log.info("Event {} ({}) already claimed, skipping", eventId, eventType);
        }
        return claimed;
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markComplete(String eventId) {
        int updated = repository.markCompleted(eventId, clock.instant());
        if (updated == 0) {
            log.warn("Event {} was not PROCESSING when marked complete", eventId);
        }
        cacheComplete(eventId);
    }

    /**
     * Records a handler failure. Runs in its own transaction because the
     * handler's transaction has already rolled back.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markFailed(String eventId, String error) {
        String message = error == null ? "unknown error" : error;
        if (message.length() > MAX_ERROR_LENGTH) {
            message = message.substring(0, MAX_ERROR_LENGTH);
        }
        int updated = repository.markFailed(eventId, message, clock.instant());
        if (updated == 0) {
            log.warn("Event {} was not PROCESSING when marked failed", eventId);
        }
    }

    @Transactional(readOnly = true)
    public Optional<PaymentEventRecord> find(String eventId) {
        return repository.findById(eventId).map(PaymentEventEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public List<PaymentEventRecord> findRecent(PaymentEventStatus status) {
        List<PaymentEventEntity> rows = status == null
                ? repository.findTop200ByOrderByClaimedAtDesc()
                : repository.findTop200ByStatusOrderByClaimedAtDesc(status);
        return rows.stream().map(PaymentEventEntity::toDomain).toList();
    }

    /**
     * Claims left in PROCESSING longer than {@code ledger.idempotency.stuck-after}.
     */
    @Transactional(readOnly = true)
    public List<PaymentEventRecord> findStuck() {
        return repository.findStuck(stuckCutoff()).stream()
                .map(PaymentEventEntity::toDomain)
                .toList();
    }

    @Transactional(readOnly = true)
    public long countStuck() {
        return repository.countStuck(stuckCutoff());
    }

    @Transactional(readOnly = true)
    public long countFailed() {
        return repository.countByStatus(PaymentEventStatus.FAILED);
    }

    private Instant stuckCutoff() {
        return clock.instant().minus(settings.getStuckAfter());
    }

    private boolean isCachedComplete(String eventId) {
        if (!settings.isRedisFastPath() || redisTemplate.isEmpty()) {
            return false;
        }
        try {
            boolean hit = Boolean.TRUE.equals(redisTemplate.get().hasKey(REDIS_KEY_PREFIX + eventId));
            if (hit) {
                metrics.recordClaimCacheHit();
            } else {
                metrics.recordClaimCacheMiss();
            }
            return hit;
        } catch (Exception e) {
            log.warn("Redis lookup failed for event {}, falling back to database: {}", eventId, e.getMessage());
            return false;
        }
    }

    private void cacheComplete(String eventId) {
        if (!settings.isRedisFastPath() || redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(REDIS_KEY_PREFIX + eventId, "COMPLETED", settings.getRedisTtl());
        } catch (Exception e) {
            log.debug("Failed to cache completed event {} in Redis: {}", eventId, e.getMessage());
        }
    }
}

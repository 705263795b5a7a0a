package com.flagship.club_ledger.transaction;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.ResultSetExtractor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.UnaryOperator;

/**
 * Bridges {@link FinancialTransaction} and its persistent form.
 *
 * Payment rows are keyed by payment intent. The check-then-insert paths hold a
 * transaction-scoped advisory lock on the payment intent id, so concurrent
 * initiation and settlement notifications for one payment serialize here. The
 * unique partial index on {@code payment_intent_id} backs this up.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TransactionLedgerStore {

    private static final String PAYMENT_INTENT_LOCK_SQL = "SELECT pg_advisory_xact_lock(hashtext(?))";

    private final FinancialTransactionRepository repository;
    private final JdbcTemplate jdbcTemplate;

    /**
     * Writes the provisional row for a freshly initiated payment unless a
     * payment for the same payment intent is already recorded.
     *
     * @return the new row, or empty if one already existed
     */
    @Transactional
    public Optional<FinancialTransaction> recordInitiation(FinancialTransaction processingRow) {
        String paymentIntentId = requirePaymentIntent(processingRow);
        lockPaymentIntent(paymentIntentId);

        Optional<FinancialTransactionEntity> existing =
                repository.findByPaymentIntentIdAndKind(paymentIntentId, TransactionKind.PAYMENT);
        if (existing.isPresent()) {
            log.info("Payment for intent {} already recorded as {} ({}), skipping initiation",
                    paymentIntentId, existing.get().getId(), existing.get().getStatus());
            return Optional.empty();
        }

        FinancialTransactionEntity saved = repository.save(FinancialTransactionEntity.fromDomain(processingRow));
        log.info("Recorded PROCESSING payment {} for intent {}: amount={} {}",
                saved.getId(), paymentIntentId, saved.getAmount(), saved.getCurrency());
        return Optional.of(saved.toDomain());
    }

    /**
     * Applies settlement to the payment for {@code paymentIntentId}. An existing
     * row is passed through {@code completer}; otherwise {@code completedRow}
     * is inserted as-is. Both run under the payment intent lock.
     *
     * @param completedRow row to insert when none exists, or null to skip
     */
    @Transactional
    public SettlementOutcome recordSettlement(String paymentIntentId,
                                              UnaryOperator<FinancialTransaction> completer,
                                              FinancialTransaction completedRow) {
        lockPaymentIntent(paymentIntentId);

        Optional<FinancialTransactionEntity> existing =
                repository.findByPaymentIntentIdAndKind(paymentIntentId, TransactionKind.PAYMENT);
        if (existing.isPresent()) {
            FinancialTransactionEntity entity = existing.get();
            FinancialTransaction before = entity.toDomain();
            FinancialTransaction after = reapplyRefunds(before, completer.apply(before));
            entity.updateFromDomain(after);
            repository.save(entity);
            log.info("Settled payment {} for intent {}: status {} -> {}, totalFee={}, net={}",
                    entity.getId(), paymentIntentId, before.getStatus(), after.getStatus(),
                    after.getTotalFee(), after.getNetAmount());
            return new SettlementOutcome(after, false);
        }

        if (completedRow == null) {
            return new SettlementOutcome(null, false);
        }
        FinancialTransactionEntity saved = repository.save(FinancialTransactionEntity.fromDomain(completedRow));
        log.info("Recorded COMPLETED payment {} for intent {} directly from settlement", saved.getId(), paymentIntentId);
        return new SettlementOutcome(saved.toDomain(), true);
    }

    /**
     * Inserts a refund row unless one with the same processor refund id is
     * already recorded. Serialized with other writes for the parent payment.
     */
    @Transactional
    public Optional<FinancialTransaction> insertRefundIfAbsent(FinancialTransaction refund) {
        if (refund.getKind() != TransactionKind.REFUND || refund.getRefundId() == null) {
            throw new IllegalArgumentException("Expected a REFUND row with a refund id");
        }
        if (refund.getPaymentIntentId() != null) {
            lockPaymentIntent(refund.getPaymentIntentId());
        }
        if (repository.findByRefundId(refund.getRefundId()).isPresent()) {
            log.info("Refund {} already recorded", refund.getRefundId());
            return Optional.empty();
        }
        return Optional.of(insert(refund));
    }

    @Transactional
    public FinancialTransaction insert(FinancialTransaction tx) {
        FinancialTransactionEntity saved = repository.save(FinancialTransactionEntity.fromDomain(tx));
        log.debug("Inserted {} transaction {} ({})", saved.getKind(), saved.getId(), saved.getStatus());
        return saved.toDomain();
    }

    /**
     * Persists a changed row. The change must be reachable from the stored
     * status through the state machine.
     */
    @Transactional
    public FinancialTransaction save(FinancialTransaction tx) {
        FinancialTransactionEntity existing = repository.findById(tx.getId())
                .orElseThrow(() -> new IllegalArgumentException("Transaction not found: " + tx.getId()));
        FinancialTransaction stored = existing.toDomain();
        if (!stored.canTransitionTo(tx.getStatus())) {
            throw new IllegalStateException(String.format(
                    "Cannot move %s transaction %s from %s to %s",
                    stored.getKind(), stored.getId(), stored.getStatus(), tx.getStatus()));
        }
        existing.updateFromDomain(tx);
        FinancialTransactionEntity updated = repository.save(existing);
        log.debug("Updated transaction {}: {} -> {}", updated.getId(), stored.getStatus(), updated.getStatus());
        return updated.toDomain();
    }

    @Transactional(readOnly = true)
    public Optional<FinancialTransaction> findById(UUID id) {
        return repository.findById(id).map(FinancialTransactionEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public Optional<FinancialTransaction> findPaymentByPaymentIntent(String paymentIntentId) {
        return repository.findByPaymentIntentIdAndKind(paymentIntentId, TransactionKind.PAYMENT)
                .map(FinancialTransactionEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public Optional<FinancialTransaction> findPaymentByCharge(String chargeId) {
        return repository.findFirstByChargeIdAndKind(chargeId, TransactionKind.PAYMENT)
                .map(FinancialTransactionEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public Optional<FinancialTransaction> findByDisputeId(String disputeId) {
        return repository.findByDisputeId(disputeId).map(FinancialTransactionEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public Optional<FinancialTransaction> findByRefundId(String refundId) {
        return repository.findByRefundId(refundId).map(FinancialTransactionEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public List<FinancialTransaction> findChildren(UUID parentId) {
        return repository.findByParentTransactionIdOrderByCreatedAtAsc(parentId).stream()
                .map(FinancialTransactionEntity::toDomain)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<FinancialTransaction> findByPaymentIntent(String paymentIntentId) {
        return repository.findByPaymentIntentIdOrderByCreatedAtAsc(paymentIntentId).stream()
                .map(FinancialTransactionEntity::toDomain)
                .toList();
    }

    /**
     * Rows on a receiving account created in {@code [from, to]} with one of the
     * given statuses. A null {@code kind} matches every kind.
     */
    @Transactional(readOnly = true)
    public List<FinancialTransaction> findForAccount(String receivingAccountRef, TransactionKind kind,
                                                     Collection<TransactionStatus> statuses,
                                                     Instant from, Instant to) {
        List<FinancialTransactionEntity> rows = kind == null
                ? repository.findByReceivingAccountRefAndStatusInAndCreatedAtBetween(
                        receivingAccountRef, statuses, from, to)
                : repository.findByReceivingAccountRefAndKindAndStatusInAndCreatedAtBetween(
                        receivingAccountRef, kind, statuses, from, to);
        return rows.stream().map(FinancialTransactionEntity::toDomain).toList();
    }

    @Transactional(readOnly = true)
    public long sumCompletedRefunds(UUID parentId) {
        return repository.sumCompletedRefunds(parentId);
    }

    @Transactional(readOnly = true)
    public long sumPendingRefunds(UUID parentId) {
        return repository.sumPendingRefunds(parentId);
    }

    /**
     * Serializes work on one payment intent until the surrounding transaction ends.
     */
    @Transactional
    public void lockPaymentIntent(String paymentIntentId) {
        jdbcTemplate.query(PAYMENT_INTENT_LOCK_SQL, (ResultSetExtractor<Void>) rs -> null, paymentIntentId);
    }

    // Refunds recorded while the payment was still PROCESSING take effect once it settles
    private FinancialTransaction reapplyRefunds(FinancialTransaction before, FinancialTransaction after) {
        if (before.getStatus() != TransactionStatus.PROCESSING || after.getStatus() != TransactionStatus.COMPLETED) {
            return after;
        }
        long refunded = repository.sumCompletedRefunds(after.getId());
        if (refunded <= 0) {
            return after;
        }
        log.info("Payment {} settled with {} of {} already refunded", after.getId(), refunded, after.getAmount());
        return after.applyRefundTotal(refunded);
    }

    private static String requirePaymentIntent(FinancialTransaction tx) {
        if (tx.getKind() != TransactionKind.PAYMENT) {
            throw new IllegalArgumentException("Expected a PAYMENT row, got " + tx.getKind());
        }
        if (tx.getPaymentIntentId() == null || tx.getPaymentIntentId().isBlank()) {
            throw new IllegalArgumentException("Payment row requires a payment intent id");
        }
        return tx.getPaymentIntentId();
    }

    /**
     * Result of {@link #recordSettlement}. {@code transaction} is null when no
     * row existed and none was supplied.
     */
    public record SettlementOutcome(FinancialTransaction transaction, boolean created) {

        public boolean skipped() {
            return transaction == null;
        }
    }
}

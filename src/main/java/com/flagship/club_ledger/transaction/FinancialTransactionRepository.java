package com.flagship.club_ledger.transaction;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface FinancialTransactionRepository extends JpaRepository<FinancialTransactionEntity, UUID> {

    Optional<FinancialTransactionEntity> findByPaymentIntentIdAndKind(String paymentIntentId, TransactionKind kind);

    Optional<FinancialTransactionEntity> findFirstByChargeIdAndKind(String chargeId, TransactionKind kind);

    Optional<FinancialTransactionEntity> findByDisputeId(String disputeId);

    Optional<FinancialTransactionEntity> findByRefundId(String refundId);

    List<FinancialTransactionEntity> findByParentTransactionIdOrderByCreatedAtAsc(UUID parentTransactionId);

    List<FinancialTransactionEntity> findByPaymentIntentIdOrderByCreatedAtAsc(String paymentIntentId);

    long countByPaymentIntentIdAndKind(String paymentIntentId, TransactionKind kind);

    List<FinancialTransactionEntity> findByReceivingAccountRefAndKindAndStatusInAndCreatedAtBetween(
            String receivingAccountRef, TransactionKind kind, Collection<TransactionStatus> statuses,
            Instant from, Instant to);

    List<FinancialTransactionEntity> findByReceivingAccountRefAndStatusInAndCreatedAtBetween(
            String receivingAccountRef, Collection<TransactionStatus> statuses, Instant from, Instant to);

    /**
     * Total confirmed refunds against a payment, as a positive number.
     */
    @Query("""
        SELECT COALESCE(SUM(-t.amount), 0) FROM FinancialTransactionEntity t
        WHERE t.parentTransactionId = :parentId
        AND t.kind = com.flagship.club_ledger.transaction.TransactionKind.REFUND
        AND t.status = com.flagship.club_ledger.transaction.TransactionStatus.COMPLETED
        """)
    long sumCompletedRefunds(@Param("parentId") UUID parentId);

    /**
     * Refunds still awaiting processor confirmation, as a positive number.
     */
    @Query("""
        SELECT COALESCE(SUM(-t.amount), 0) FROM FinancialTransactionEntity t
        WHERE t.parentTransactionId = :parentId
        AND t.kind = com.flagship.club_ledger.transaction.TransactionKind.REFUND
        AND t.status = com.flagship.club_ledger.transaction.TransactionStatus.PROCESSING
        """)
    long sumPendingRefunds(@Param("parentId") UUID parentId);
}

package com.flagship.club_ledger.webhook;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface PaymentEventRepository extends JpaRepository<PaymentEventEntity, String> {

    @Modifying
    @Query("""
        UPDATE PaymentEventEntity e
        SET e.status = com.flagship.club_ledger.webhook.PaymentEventStatus.COMPLETED,
            e.completedAt = :at, e.error = NULL
        WHERE e.id = :id
        AND e.status = com.flagship.club_ledger.webhook.PaymentEventStatus.PROCESSING
        """)
    int markCompleted(@Param("id") String id, @Param("at") Instant at);

    @Modifying
    @Query("""
        UPDATE PaymentEventEntity e
        SET e.status = com.flagship.club_ledger.webhook.PaymentEventStatus.FAILED,
            e.failedAt = :at, e.error = :error
        WHERE e.id = :id
        AND e.status = com.flagship.club_ledger.webhook.PaymentEventStatus.PROCESSING
        """)
    int markFailed(@Param("id") String id, @Param("error") String error, @Param("at") Instant at);

    List<PaymentEventEntity> findTop200ByStatusOrderByClaimedAtDesc(PaymentEventStatus status);

    List<PaymentEventEntity> findTop200ByOrderByClaimedAtDesc();

    @Query("""
        SELECT e FROM PaymentEventEntity e
        WHERE e.status = com.flagship.club_ledger.webhook.PaymentEventStatus.PROCESSING
        AND e.claimedAt < :cutoff
        ORDER BY e.claimedAt ASC
        """)
    List<PaymentEventEntity> findStuck(@Param("cutoff") Instant cutoff);

    @Query("""
        SELECT COUNT(e) FROM PaymentEventEntity e
        WHERE e.status = com.flagship.club_ledger.webhook.PaymentEventStatus.PROCESSING
        AND e.claimedAt < :cutoff
        """)
    long countStuck(@Param("cutoff") Instant cutoff);

    long countByStatus(PaymentEventStatus status);
}

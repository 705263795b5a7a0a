package com.flagship.club_ledger.webhook;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * JPA view of {@code payment_events}. Rows are inserted by the gate's atomic
 * claim statement and changed only through the repository's update queries.
 */
@Entity
@Table(name = "payment_events")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class PaymentEventEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private String id;

    @Column(name = "type", nullable = false, updatable = false, length = 100)
    private String type;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private PaymentEventStatus status;

    @Column(name = "claimed_at", nullable = false)
    private Instant claimedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "failed_at")
    private Instant failedAt;

    @Column(name = "error", columnDefinition = "TEXT")
    private String error;

    @Column(name = "attempts", nullable = false)
    private int attempts;

    public PaymentEventRecord toDomain() {
        return new PaymentEventRecord(id, type, status, claimedAt, completedAt, failedAt, error, attempts);
    }
}

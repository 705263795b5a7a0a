package com.flagship.club_ledger.transaction;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for the {@code transactions} table.
 *
 * No setters. Rows are created through {@link #fromDomain} and changed only
 * through {@link #updateFromDomain}, which leaves identity, kind, parties and
 * correlation keys alone.
 */
@Entity
@Table(name = "transactions")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class FinancialTransactionEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 20)
    private TransactionKind kind;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    private TransactionStatus status;

    @Column(nullable = false)
    private long amount;

    @Column(nullable = false, updatable = false, length = 3)
    private String currency;

    @Column(name = "receiving_account_ref", updatable = false)
    private String receivingAccountRef;

    @Column(name = "organizer_ref", updatable = false)
    private String organizerRef;

    @Column(name = "payer_ref", updatable = false)
    private String payerRef;

    @Column(name = "payer_name", updatable = false)
    private String payerName;

    @Column(name = "payer_email", updatable = false)
    private String payerEmail;

    @Column(name = "purpose_type", updatable = false, length = 50)
    private String purposeType;

    @Column(name = "reference_id", updatable = false)
    private String referenceId;

    @Column(name = "reference_name", updatable = false)
    private String referenceName;

    @Column(name = "payment_intent_id", updatable = false)
    private String paymentIntentId;

    @Column(name = "charge_id")
    private String chargeId;

    @Column(name = "settlement_id")
    private String settlementId;

    @Column(name = "checkout_session_id", updatable = false)
    private String checkoutSessionId;

    @Column(name = "refund_id", updatable = false)
    private String refundId;

    @Column(name = "dispute_id", updatable = false)
    private String disputeId;

    @Column(name = "parent_transaction_id", updatable = false)
    private UUID parentTransactionId;

    @Column(name = "platform_fee", nullable = false)
    private long platformFee;

    @Column(name = "total_fee", nullable = false)
    private long totalFee;

    @Column(name = "net_amount", nullable = false)
    private long netAmount;

    @Column(name = "application_fee_id")
    private String applicationFeeId;

    @Column(name = "payment_method_type", length = 50)
    private String paymentMethodType;

    @Column(name = "card_last4", length = 4)
    private String cardLast4;

    @Column(name = "refund_reason")
    private String refundReason;

    @Column(name = "fee_refund_estimated", nullable = false)
    private boolean feeRefundEstimated;

    @Column(name = "dispute_reason")
    private String disputeReason;

    @Column(name = "processor_dispute_status", length = 50)
    private String processorDisputeStatus;

    @Column(name = "dispute_due_by")
    private Instant disputeDueBy;

    @Column(nullable = false, updatable = false)
    private boolean livemode;

    @Column(name = "webhook_event_id", updatable = false)
    private String webhookEventId;

    @Column(name = "initiated_by", updatable = false)
    private String initiatedBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Version
    private Long version;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static FinancialTransactionEntity fromDomain(FinancialTransaction tx) {
        return new FinancialTransactionEntity(
                tx.getId(),
                tx.getKind(),
                tx.getStatus(),
                tx.getAmount(),
                FinancialTransaction.canonicalCurrency(tx.getCurrency()),
                tx.getReceivingAccountRef(),
                tx.getOrganizerRef(),
                tx.getPayerRef(),
                tx.getPayerName(),
                tx.getPayerEmail(),
                tx.getPurposeType(),
                tx.getReferenceId(),
                tx.getReferenceName(),
                tx.getPaymentIntentId(),
                tx.getChargeId(),
                tx.getSettlementId(),
                tx.getCheckoutSessionId(),
                tx.getRefundId(),
                tx.getDisputeId(),
                tx.getParentTransactionId(),
                tx.getPlatformFee(),
                tx.getTotalFee(),
                tx.getNetAmount(),
                tx.getApplicationFeeId(),
                tx.getPaymentMethodType(),
                tx.getCardLast4(),
                tx.getRefundReason(),
                tx.isFeeRefundEstimated(),
                tx.getDisputeReason(),
                tx.getProcessorDisputeStatus(),
                tx.getDisputeDueBy(),
                tx.isLivemode(),
                tx.getWebhookEventId(),
                tx.getInitiatedBy(),
                null, // createdAt, set by @PrePersist
                null, // updatedAt, set by @PrePersist
                tx.getCompletedAt(),
                null  // version, null marks the entity as new
        );
    }

    public FinancialTransaction toDomain() {
        return FinancialTransaction.builder()
                .id(id)
                .kind(kind)
                .status(status)
                .amount(amount)
                .currency(currency)
                .receivingAccountRef(receivingAccountRef)
                .organizerRef(organizerRef)
                .payerRef(payerRef)
                .payerName(payerName)
                .payerEmail(payerEmail)
                .purposeType(purposeType)
                .referenceId(referenceId)
                .referenceName(referenceName)
                .paymentIntentId(paymentIntentId)
                .chargeId(chargeId)
                .settlementId(settlementId)
                .checkoutSessionId(checkoutSessionId)
                .refundId(refundId)
                .disputeId(disputeId)
                .parentTransactionId(parentTransactionId)
                .platformFee(platformFee)
                .totalFee(totalFee)
                .netAmount(netAmount)
                .applicationFeeId(applicationFeeId)
                .paymentMethodType(paymentMethodType)
                .cardLast4(cardLast4)
                .refundReason(refundReason)
                .feeRefundEstimated(feeRefundEstimated)
                .disputeReason(disputeReason)
                .processorDisputeStatus(processorDisputeStatus)
                .disputeDueBy(disputeDueBy)
                .livemode(livemode)
                .webhookEventId(webhookEventId)
                .initiatedBy(initiatedBy)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .completedAt(completedAt)
                .version(version)
                .build();
    }

    /**
     * Copies the fields that change over a row's life: status, amounts, fees,
     * settlement references and dispute details.
     */
    void updateFromDomain(FinancialTransaction tx) {
        this.status = tx.getStatus();
        this.amount = tx.getAmount();
        this.platformFee = tx.getPlatformFee();
        this.totalFee = tx.getTotalFee();
        this.netAmount = tx.getNetAmount();
        this.chargeId = tx.getChargeId();
        this.settlementId = tx.getSettlementId();
        this.applicationFeeId = tx.getApplicationFeeId();
        this.paymentMethodType = tx.getPaymentMethodType();
        this.cardLast4 = tx.getCardLast4();
        this.refundReason = tx.getRefundReason();
        this.feeRefundEstimated = tx.isFeeRefundEstimated();
        this.disputeReason = tx.getDisputeReason();
        this.processorDisputeStatus = tx.getProcessorDisputeStatus();
        this.disputeDueBy = tx.getDisputeDueBy();
        this.completedAt = tx.getCompletedAt();
    }
}

package com.flagship.club_ledger.transaction;

import com.flagship.club_ledger.processor.SettlementDetails;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Locale;
import java.util.UUID;

/**
 * One row of the ledger: a payment, a refund against a payment, or a dispute
 * against a payment.
 *
 * Amounts are signed minor units. Payments are positive; refunds and held
 * dispute amounts are negative. Instances are immutable and every status
 * change goes through a transition method that validates it.
 */
@Value
@Builder(toBuilder = true)
public class FinancialTransaction {
    UUID id;
    TransactionKind kind;
    TransactionStatus status;
    long amount;
    String currency;

    String receivingAccountRef;
    String organizerRef;
    String payerRef;
    String payerName;
    String payerEmail;

    String purposeType;
    String referenceId;
    String referenceName;

    String paymentIntentId;
    String chargeId;
    String settlementId;
    String checkoutSessionId;
    String refundId;
    String disputeId;
    UUID parentTransactionId;

    long platformFee;
    long totalFee;
    long netAmount;

    String applicationFeeId;
    String paymentMethodType;
    String cardLast4;
    String refundReason;
    boolean feeRefundEstimated;
    String disputeReason;
    String processorDisputeStatus;
    Instant disputeDueBy;
    boolean livemode;
    String webhookEventId;
    String initiatedBy;

    Instant createdAt;
    Instant updatedAt;
    Instant completedAt;
    Long version;

    public static String canonicalCurrency(String currency) {
        if (currency == null || currency.isBlank()) {
            throw new IllegalArgumentException("Currency is required");
        }
        return currency.trim().toUpperCase(Locale.ROOT);
    }

    /**
     * Completes a payment from the processor's settlement record. The platform
     * fee is the processor's application fee, never a local estimate.
     *
     * @throws IllegalStateException if this is not a payment that can complete
     */
    public FinancialTransaction settle(SettlementDetails settlement, String chargeId, Instant at) {
        requireKind(TransactionKind.PAYMENT, "settle");
        if (status == TransactionStatus.COMPLETED) {
            return this;
        }
        requireTransition(TransactionStatus.COMPLETED);
        return toBuilder()
                .status(TransactionStatus.COMPLETED)
                .chargeId(chargeId)
                .settlementId(settlement.settlementId())
                .platformFee(settlement.applicationFee())
                .totalFee(settlement.totalFee())
                .netAmount(settlement.netAmount())
                .completedAt(at)
                .build();
    }

    /**
     * Confirms a provisional refund with the amount the processor reports.
     */
    public FinancialTransaction confirmRefund(long confirmedAmount, Instant at) {
        requireKind(TransactionKind.REFUND, "confirm refund");
        requireTransition(TransactionStatus.COMPLETED);
        long signed = -Math.abs(confirmedAmount);
        return toBuilder()
                .status(TransactionStatus.COMPLETED)
                .amount(signed)
                .netAmount(signed)
                .completedAt(at)
                .build();
    }

    public FinancialTransaction fail() {
        requireTransition(TransactionStatus.FAILED);
        return toBuilder().status(TransactionStatus.FAILED).build();
    }

    /**
     * Derives the payment status from the cumulative refunded amount.
     */
    public FinancialTransaction applyRefundTotal(long refundedTotal) {
        requireKind(TransactionKind.PAYMENT, "apply refunds");
        if (refundedTotal <= 0) {
            return this;
        }
        TransactionStatus target = refundedTotal >= amount
                ? TransactionStatus.REFUNDED
                : TransactionStatus.PARTIALLY_REFUNDED;
        return transitionTo(target);
    }

    public FinancialTransaction markDisputed() {
        requireKind(TransactionKind.PAYMENT, "dispute");
        return transitionTo(TransactionStatus.DISPUTED);
    }

    /** Dispute won: the payment stands again. */
    public FinancialTransaction restoreAfterDispute() {
        requireKind(TransactionKind.PAYMENT, "restore");
        return transitionTo(TransactionStatus.COMPLETED);
    }

    public FinancialTransaction markDisputeLost() {
        requireKind(TransactionKind.PAYMENT, "lose dispute");
        return transitionTo(TransactionStatus.DISPUTE_LOST);
    }

    /** Won disputes release the held funds, so the row nets to zero. */
    public FinancialTransaction resolveDisputeWon(Instant at) {
        requireKind(TransactionKind.DISPUTE, "resolve dispute");
        requireTransition(TransactionStatus.WON);
        return toBuilder()
                .status(TransactionStatus.WON)
                .amount(0)
                .netAmount(0)
                .processorDisputeStatus("won")
                .completedAt(at)
                .build();
    }

    public FinancialTransaction resolveDisputeLost(Instant at) {
        requireKind(TransactionKind.DISPUTE, "resolve dispute");
        requireTransition(TransactionStatus.LOST);
        return toBuilder()
                .status(TransactionStatus.LOST)
                .processorDisputeStatus("lost")
                .completedAt(at)
                .build();
    }

    public FinancialTransaction closeDispute(String processorStatus, Instant at) {
        requireKind(TransactionKind.DISPUTE, "close dispute");
        requireTransition(TransactionStatus.CLOSED);
        return toBuilder()
                .status(TransactionStatus.CLOSED)
                .processorDisputeStatus(processorStatus)
                .completedAt(at)
                .build();
    }

    public FinancialTransaction transitionTo(TransactionStatus target) {
        if (status == target) {
            return this;
        }
        requireTransition(target);
        return toBuilder().status(target).build();
    }

    public boolean isTerminal() {
        return switch (kind) {
            case PAYMENT -> status == TransactionStatus.REFUNDED
                    || status == TransactionStatus.DISPUTE_LOST
                    || status == TransactionStatus.FAILED;
            case REFUND -> status == TransactionStatus.COMPLETED || status == TransactionStatus.FAILED;
            case DISPUTE -> status != TransactionStatus.OPEN;
        };
    }

    /**
     * Checks if a transition from the current status to the target is allowed
     * for this kind of row. Same status is always allowed.
     */
    public boolean canTransitionTo(TransactionStatus target) {
        if (status == target) {
            return true;
        }
        return switch (kind) {
            case PAYMENT -> switch (status) {
                case PROCESSING -> target == TransactionStatus.COMPLETED || target == TransactionStatus.FAILED;
                case COMPLETED -> target == TransactionStatus.REFUNDED
                        || target == TransactionStatus.PARTIALLY_REFUNDED
                        || target == TransactionStatus.DISPUTED;
                case PARTIALLY_REFUNDED -> target == TransactionStatus.REFUNDED
                        || target == TransactionStatus.DISPUTED;
                case DISPUTED -> target == TransactionStatus.COMPLETED || target == TransactionStatus.DISPUTE_LOST;
                default -> false;
            };
            case REFUND -> status == TransactionStatus.PROCESSING
                    && (target == TransactionStatus.COMPLETED || target == TransactionStatus.FAILED);
            case DISPUTE -> status == TransactionStatus.OPEN
                    && (target == TransactionStatus.WON
                        || target == TransactionStatus.LOST
                        || target == TransactionStatus.CLOSED);
        };
    }

    private void requireTransition(TransactionStatus target) {
        if (!canTransitionTo(target)) {
            throw new IllegalStateException(String.format(
                    "Cannot move %s transaction %s from %s to %s", kind, id, status, target));
        }
    }

    private void requireKind(TransactionKind expected, String action) {
        if (kind != expected) {
            throw new IllegalStateException(String.format(
                    "Cannot %s on %s transaction %s", action, kind, id));
        }
    }
}

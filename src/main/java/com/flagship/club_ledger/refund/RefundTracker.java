package com.flagship.club_ledger.refund;

import com.flagship.club_ledger.notification.RefundReceipt;
import com.flagship.club_ledger.notification.ReceiptNotifier;
import com.flagship.club_ledger.observability.CorrelationContext;
import com.flagship.club_ledger.observability.LedgerMetrics;
import com.flagship.club_ledger.payment.RecordingOutcome;
import com.flagship.club_ledger.processor.ChargeSnapshot;
import com.flagship.club_ledger.processor.IssuedRefund;
import com.flagship.club_ledger.processor.PaymentProcessorClient;
import com.flagship.club_ledger.processor.ProcessorEvent;
import com.flagship.club_ledger.processor.RefundInstruction;
import com.flagship.club_ledger.processor.RefundSnapshot;
import com.flagship.club_ledger.transaction.FinancialTransaction;
import com.flagship.club_ledger.transaction.TransactionKind;
import com.flagship.club_ledger.transaction.TransactionLedgerStore;
import com.flagship.club_ledger.transaction.TransactionStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Keeps refund rows and the refunded status of payments in line with the
 * processor.
 *
 * Refunds requested here are written as PROCESSING and confirmed by the
 * processor's refund notification. Refunds issued elsewhere (processor
 * dashboard) first appear on that notification and are recorded directly as
 * COMPLETED.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RefundTracker {

    private final TransactionLedgerStore ledgerStore;
    private final PaymentProcessorClient processorClient;
    private final ReceiptNotifier receiptNotifier;
    private final LedgerMetrics metrics;
    private final Clock clock;

    /**
     * Reconciles every refund on a charge. Runs as one transaction, so a
     * refund that would exceed the gross leaves nothing half-applied.
     *
     * @throws IllegalStateException if confirmed refunds would exceed the payment's gross
     */
    @Transactional
    public RecordingOutcome onRefundNotified(ChargeSnapshot charge, ProcessorEvent event) {
        if (!event.targetsReceivingAccount()) {
            log.info("Refund on platform charge {}, ignoring", charge.chargeId());
            metrics.recordSkipped(event.type(), "platform_account");
            return RecordingOutcome.SKIPPED;
        }
        Optional<FinancialTransaction> found = findParent(charge);
        if (found.isEmpty()) {
            log.warn("Refund notification for unknown charge {}", charge.chargeId());
            metrics.recordSkipped(event.type(), "unknown_charge");
            return RecordingOutcome.SKIPPED;
        }
        if (found.get().getPaymentIntentId() != null) {
            ledgerStore.lockPaymentIntent(found.get().getPaymentIntentId());
        }
        // Re-read under the lock
        FinancialTransaction parent = ledgerStore.findById(found.get().getId()).orElseThrow();
        MDC.put(CorrelationContext.TRANSACTION_ID_MDC_KEY, parent.getId().toString());

        List<RefundSnapshot> refunds = charge.hasRefundList()
                ? charge.refunds()
                : processorClient.listRefunds(charge.chargeId(), event.receivingAccountRef());

        int applied = 0;
        for (RefundSnapshot refund : refunds) {
            if (applyRefund(parent, refund, charge.chargeId(), event.id())) {
                applied++;
            }
        }

        long refundedTotal = ledgerStore.sumCompletedRefunds(parent.getId());
        updateParentStatus(parent, refundedTotal);
        log.info("Refund notification for payment {}: {} new refund(s), refunded {} of {}",
                parent.getId(), applied, refundedTotal, parent.getAmount());
        return applied > 0 ? RecordingOutcome.RECORDED : RecordingOutcome.ALREADY_RECORDED;
    }

    /**
     * Issues a refund through the processor and records it as PROCESSING.
     *
     * @param amount refund amount in minor units, or null for the full gross
     * @return the processor's refund id and the new ledger row
     * @throws InvalidRefundRequestException if the payment cannot be refunded by this amount
     */
    public RefundResult createRefund(UUID transactionId, Long amount, String reason, String initiatedBy) {
        FinancialTransaction payment = ledgerStore.findById(transactionId)
                .orElseThrow(() -> new InvalidRefundRequestException("Transaction not found: " + transactionId));
        if (payment.getKind() != TransactionKind.PAYMENT) {
            throw new InvalidRefundRequestException("Only payments can be refunded, got " + payment.getKind());
        }
        if (payment.getStatus() != TransactionStatus.COMPLETED
                && payment.getStatus() != TransactionStatus.PARTIALLY_REFUNDED) {
            throw new InvalidRefundRequestException("Payment is " + payment.getStatus() + ", not refundable");
        }
        if (payment.getChargeId() == null) {
            throw new InvalidRefundRequestException("Payment has no charge id");
        }
        if (payment.getReceivingAccountRef() == null) {
            throw new InvalidRefundRequestException("Payment has no receiving account");
        }

        long requested = amount != null ? amount : payment.getAmount();
        if (requested <= 0) {
            throw new InvalidRefundRequestException("Refund amount must be positive");
        }
        if (requested > payment.getAmount()) {
            throw new InvalidRefundRequestException(String.format(
                    "Refund amount %d exceeds payment amount %d", requested, payment.getAmount()));
        }
        long alreadyRefunded = ledgerStore.sumCompletedRefunds(payment.getId())
                + ledgerStore.sumPendingRefunds(payment.getId());
        if (requested > payment.getAmount() - alreadyRefunded) {
            throw new InvalidRefundRequestException(String.format(
                    "Refund amount %d exceeds refundable balance %d", requested, payment.getAmount() - alreadyRefunded));
        }

        MDC.put(CorrelationContext.TRANSACTION_ID_MDC_KEY, payment.getId().toString());
        try {
            return issueAndRecord(payment, requested, reason, initiatedBy);
        } finally {
            MDC.remove(CorrelationContext.TRANSACTION_ID_MDC_KEY);
        }
    }

    private RefundResult issueAndRecord(FinancialTransaction payment, long requested,
                                        String reason, String initiatedBy) {
        IssuedRefund issued = processorClient.issueRefund(new RefundInstruction(
                payment.getChargeId(), payment.getReceivingAccountRef(), requested, reason));
        log.info("Processor refund {} issued for payment {}: amount={}, by={}",
                issued.refundId(), payment.getId(), requested, initiatedBy);

        FinancialTransaction row = refundRow(payment, issued.refundId(), requested)
                .status(TransactionStatus.PROCESSING)
                .refundReason(reason)
                .initiatedBy(initiatedBy)
                .build();
        Optional<FinancialTransaction> recorded = ledgerStore.insertRefundIfAbsent(row);
        FinancialTransaction refundRow = recorded.orElseGet(() ->
                // Refund notification beat us to it
                ledgerStore.findByRefundId(issued.refundId()).orElseThrow());
        metrics.recordRefund("requested");

        return new RefundResult(issued.refundId(), refundRow.getId(), payment.getId(),
                requested, refundRow.getStatus());
    }

    private boolean applyRefund(FinancialTransaction parent, RefundSnapshot refund,
                                String chargeId, String eventId) {
        Optional<FinancialTransaction> existing = ledgerStore.findByRefundId(refund.refundId());

        if (refund.isFailed()) {
            existing.filter(row -> row.getStatus() == TransactionStatus.PROCESSING).ifPresent(row -> {
                ledgerStore.save(row.fail());
                log.warn("Refund {} failed at the processor", refund.refundId());
            });
            return false;
        }
        if (existing.isPresent() && existing.get().getStatus() != TransactionStatus.PROCESSING) {
            log.debug("Refund {} already {}", refund.refundId(), existing.get().getStatus());
            return false;
        }

        long completed = ledgerStore.sumCompletedRefunds(parent.getId());
        if (completed + refund.amount() > parent.getAmount()) {
            throw new IllegalStateException(String.format(
                    "Refund %s of %d would take payment %s to %d refunded, above its gross %d",
                    refund.refundId(), refund.amount(), parent.getId(), completed + refund.amount(), parent.getAmount()));
        }

        Instant now = clock.instant();
        FinancialTransaction confirmed;
        if (existing.isPresent()) {
            confirmed = ledgerStore.save(existing.get().confirmRefund(refund.amount(), now));
            metrics.recordRefund("confirmed");
            log.info("Refund {} confirmed: {}", refund.refundId(), refund.amount());
        } else {
            confirmed = ledgerStore.insert(refundRow(parent, refund.refundId(), refund.amount())
                    .status(TransactionStatus.COMPLETED)
                    .chargeId(chargeId)
                    .webhookEventId(eventId)
                    .completedAt(now)
                    .build());
            metrics.recordRefund("external");
            log.info("External refund {} recorded: {}", refund.refundId(), refund.amount());
        }
        receiptNotifier.notifyRefundReceipt(RefundReceipt.from(confirmed, parent));
        return true;
    }

    private void updateParentStatus(FinancialTransaction parent, long refundedTotal) {
        if (refundedTotal <= 0) {
            return;
        }
        TransactionStatus target = refundedTotal >= parent.getAmount()
                ? TransactionStatus.REFUNDED
                : TransactionStatus.PARTIALLY_REFUNDED;
        if (!parent.canTransitionTo(target)) {
            log.warn("Payment {} is {}, leaving status as is after refunds totalling {}",
                    parent.getId(), parent.getStatus(), refundedTotal);
            return;
        }
        ledgerStore.save(parent.applyRefundTotal(refundedTotal));
    }

    private Optional<FinancialTransaction> findParent(ChargeSnapshot charge) {
        Optional<FinancialTransaction> byCharge = ledgerStore.findPaymentByCharge(charge.chargeId());
        if (byCharge.isPresent() || charge.paymentIntentId() == null) {
            return byCharge;
        }
        return ledgerStore.findPaymentByPaymentIntent(charge.paymentIntentId());
    }

    private FinancialTransaction.FinancialTransactionBuilder refundRow(FinancialTransaction payment,
                                                                       String refundId, long amount) {
        long signed = -Math.abs(amount);
        return FinancialTransaction.builder()
                .id(UUID.randomUUID())
                .kind(TransactionKind.REFUND)
                .amount(signed)
                .netAmount(signed)
                .platformFee(-estimatedFeeShare(payment, amount))
                .feeRefundEstimated(true)
                .currency(payment.getCurrency())
                .receivingAccountRef(payment.getReceivingAccountRef())
                .organizerRef(payment.getOrganizerRef())
                .payerRef(payment.getPayerRef())
                .payerName(payment.getPayerName())
                .payerEmail(payment.getPayerEmail())
                .purposeType(payment.getPurposeType())
                .referenceId(payment.getReferenceId())
                .referenceName(payment.getReferenceName())
                .paymentIntentId(payment.getPaymentIntentId())
                .chargeId(payment.getChargeId())
                .refundId(refundId)
                .parentTransactionId(payment.getId())
                .livemode(payment.isLivemode());
    }

    /**
     * Pro-rata share of the platform fee, for reporting only.
     */
    private static long estimatedFeeShare(FinancialTransaction payment, long amount) {
        if (payment.getAmount() <= 0 || payment.getPlatformFee() == 0) {
            return 0;
        }
        return BigDecimal.valueOf(payment.getPlatformFee())
                .multiply(BigDecimal.valueOf(amount))
                .divide(BigDecimal.valueOf(payment.getAmount()), 0, RoundingMode.HALF_UP)
                .longValueExact();
    }
}

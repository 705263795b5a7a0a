package com.flagship.club_ledger.dispute;

import com.flagship.club_ledger.observability.CorrelationContext;
import com.flagship.club_ledger.observability.LedgerMetrics;
import com.flagship.club_ledger.payment.RecordingOutcome;
import com.flagship.club_ledger.processor.DisputeSnapshot;
import com.flagship.club_ledger.processor.ProcessorEvent;
import com.flagship.club_ledger.transaction.FinancialTransaction;
import com.flagship.club_ledger.transaction.TransactionKind;
import com.flagship.club_ledger.transaction.TransactionLedgerStore;
import com.flagship.club_ledger.transaction.TransactionStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * Records chargebacks against payments.
 *
 * An open dispute holds the disputed amount as a negative DISPUTE row and
 * marks the payment DISPUTED. Closing it either releases the hold (won),
 * keeps it (lost) or, for any other terminal processor status, just closes
 * the row.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DisputeTracker {

    private final TransactionLedgerStore ledgerStore;
    private final LedgerMetrics metrics;
    private final Clock clock;

    @Transactional
    public RecordingOutcome onDisputeOpened(DisputeSnapshot dispute, ProcessorEvent event) {
        if (!event.targetsReceivingAccount()) {
            metrics.recordSkipped(event.type(), "platform_account");
            return RecordingOutcome.SKIPPED;
        }
        if (ledgerStore.findByDisputeId(dispute.disputeId()).isPresent()) {
            log.info("Dispute {} already recorded", dispute.disputeId());
            return RecordingOutcome.ALREADY_RECORDED;
        }
        Optional<FinancialTransaction> found = ledgerStore.findPaymentByCharge(dispute.chargeId());
        if (found.isEmpty()) {
            log.warn("Dispute {} opened on unknown charge {}", dispute.disputeId(), dispute.chargeId());
            metrics.recordSkipped(event.type(), "unknown_charge");
            return RecordingOutcome.SKIPPED;
        }
        FinancialTransaction parent = lockAndReload(found.get());
        // Lost the race to a concurrent delivery of the same dispute
        if (ledgerStore.findByDisputeId(dispute.disputeId()).isPresent()) {
            return RecordingOutcome.ALREADY_RECORDED;
        }

        long held = -Math.abs(dispute.amount());
        FinancialTransaction row = ledgerStore.insert(FinancialTransaction.builder()
                .id(UUID.randomUUID())
                .kind(TransactionKind.DISPUTE)
                .status(TransactionStatus.OPEN)
                .amount(held)
                .netAmount(held)
                .currency(parent.getCurrency())
                .receivingAccountRef(parent.getReceivingAccountRef())
                .organizerRef(parent.getOrganizerRef())
                .payerRef(parent.getPayerRef())
                .payerName(parent.getPayerName())
                .payerEmail(parent.getPayerEmail())
                .purposeType(parent.getPurposeType())
                .referenceId(parent.getReferenceId())
                .referenceName(parent.getReferenceName())
                .paymentIntentId(parent.getPaymentIntentId())
                .chargeId(dispute.chargeId())
                .disputeId(dispute.disputeId())
                .parentTransactionId(parent.getId())
                .disputeReason(dispute.reason())
                .processorDisputeStatus(dispute.status())
                .disputeDueBy(dispute.evidenceDueBy())
                .livemode(event.livemode())
                .webhookEventId(event.id())
                .build());

        if (parent.canTransitionTo(TransactionStatus.DISPUTED)) {
            ledgerStore.save(parent.markDisputed());
        } else {
            log.warn("Payment {} is {}, not marking it DISPUTED", parent.getId(), parent.getStatus());
        }
        metrics.recordDispute("opened");
        log.info("Dispute {} opened on payment {}: held={}, reason={}, dueBy={}",
                dispute.disputeId(), parent.getId(), held, dispute.reason(), dispute.evidenceDueBy());
        MDC.put(CorrelationContext.TRANSACTION_ID_MDC_KEY, row.getId().toString());
        return RecordingOutcome.RECORDED;
    }

    /**
     * Refreshes the processor status, reason and evidence due date of an open
     * dispute. Amounts and statuses are left alone.
     */
    @Transactional
    public RecordingOutcome onDisputeUpdated(DisputeSnapshot dispute, ProcessorEvent event) {
        Optional<FinancialTransaction> existing = ledgerStore.findByDisputeId(dispute.disputeId());
        if (existing.isEmpty()) {
            log.warn("Update for unknown dispute {}", dispute.disputeId());
            metrics.recordSkipped(event.type(), "unknown_dispute");
            return RecordingOutcome.SKIPPED;
        }
        FinancialTransaction row = existing.get();
        if (row.getStatus() != TransactionStatus.OPEN) {
            log.info("Dispute {} already {}, ignoring update to status={}",
                    dispute.disputeId(), row.getStatus(), dispute.status());
            return RecordingOutcome.ALREADY_RECORDED;
        }
        ledgerStore.save(row.toBuilder()
                .processorDisputeStatus(dispute.status())
                .disputeReason(dispute.reason() != null ? dispute.reason() : row.getDisputeReason())
                .disputeDueBy(dispute.evidenceDueBy() != null ? dispute.evidenceDueBy() : row.getDisputeDueBy())
                .build());
        log.info("Dispute {} updated: status={}", dispute.disputeId(), dispute.status());
        return RecordingOutcome.RECORDED;
    }

    /**
     * @throws InvalidDisputeStateException if the dispute was already resolved differently
     */
    @Transactional
    public RecordingOutcome onDisputeClosed(DisputeSnapshot dispute, ProcessorEvent event) {
        Optional<FinancialTransaction> existing = ledgerStore.findByDisputeId(dispute.disputeId());
        if (existing.isEmpty()) {
            log.warn("Close for unknown dispute {}", dispute.disputeId());
            metrics.recordSkipped(event.type(), "unknown_dispute");
            return RecordingOutcome.SKIPPED;
        }
        TransactionStatus outcome = outcomeOf(dispute.status());
        Optional<FinancialTransaction> parentRow = ledgerStore.findById(existing.get().getParentTransactionId());
        if (parentRow.isEmpty()) {
            throw new IllegalStateException("Dispute " + dispute.disputeId() + " has no parent payment");
        }
        FinancialTransaction parent = lockAndReload(parentRow.get());
        FinancialTransaction row = ledgerStore.findByDisputeId(dispute.disputeId()).orElseThrow();
        MDC.put(CorrelationContext.TRANSACTION_ID_MDC_KEY, row.getId().toString());

        if (row.getStatus() != TransactionStatus.OPEN) {
            if (row.getStatus() == outcome) {
                log.info("Dispute {} already {}", dispute.disputeId(), outcome);
                return RecordingOutcome.ALREADY_RECORDED;
            }
            throw new InvalidDisputeStateException(String.format(
                    "Dispute %s already resolved as %s, cannot close as %s",
                    dispute.disputeId(), row.getStatus(), outcome));
        }

        switch (outcome) {
            case WON -> {
                ledgerStore.save(row.resolveDisputeWon(clock.instant()));
                if (parent.canTransitionTo(TransactionStatus.COMPLETED)) {
                    FinancialTransaction restored = ledgerStore.save(parent.restoreAfterDispute());
                    reapplyRefunds(restored);
                } else {
                    log.warn("Payment {} is {}, not restoring after won dispute", parent.getId(), parent.getStatus());
                }
            }
            case LOST -> {
                ledgerStore.save(row.resolveDisputeLost(clock.instant()));
                if (parent.canTransitionTo(TransactionStatus.DISPUTE_LOST)) {
                    ledgerStore.save(parent.markDisputeLost());
                } else {
                    log.warn("Payment {} is {}, not marking it DISPUTE_LOST", parent.getId(), parent.getStatus());
                }
            }
            default -> {
                ledgerStore.save(row.closeDispute(dispute.status(), clock.instant()));
                log.info("Dispute {} closed with processor status {}, payment {} unchanged",
                        dispute.disputeId(), dispute.status(), parent.getId());
            }
        }
        metrics.recordDispute(outcome.name().toLowerCase(Locale.ROOT));
        log.info("Dispute {} resolved: {}", dispute.disputeId(), outcome);
        return RecordingOutcome.RECORDED;
    }

    private FinancialTransaction lockAndReload(FinancialTransaction payment) {
        if (payment.getPaymentIntentId() != null) {
            ledgerStore.lockPaymentIntent(payment.getPaymentIntentId());
        }
        return ledgerStore.findById(payment.getId()).orElseThrow();
    }

    // A restored payment that had partial refunds goes back to PARTIALLY_REFUNDED
    private void reapplyRefunds(FinancialTransaction payment) {
        long refunded = ledgerStore.sumCompletedRefunds(payment.getId());
        if (refunded > 0) {
            ledgerStore.save(payment.applyRefundTotal(refunded));
        }
    }

    static TransactionStatus outcomeOf(String processorStatus) {
        if (DisputeSnapshot.WON.equals(processorStatus)) {
            return TransactionStatus.WON;
        }
        if (DisputeSnapshot.LOST.equals(processorStatus)) {
            return TransactionStatus.LOST;
        }
        return TransactionStatus.CLOSED;
    }
}

package com.flagship.club_ledger.payment;

import com.flagship.club_ledger.feelock.AccountFeeLockService;
import com.flagship.club_ledger.notification.PaymentReceipt;
import com.flagship.club_ledger.notification.ReceiptNotifier;
import com.flagship.club_ledger.observability.CorrelationContext;
import com.flagship.club_ledger.observability.LedgerMetrics;
import com.flagship.club_ledger.processor.ChargeSnapshot;
import com.flagship.club_ledger.processor.CheckoutSessionSnapshot;
import com.flagship.club_ledger.processor.PaymentIntentSnapshot;
import com.flagship.club_ledger.processor.PaymentProcessorClient;
import com.flagship.club_ledger.processor.ProcessorEvent;
import com.flagship.club_ledger.processor.SettlementDetails;
import com.flagship.club_ledger.transaction.FinancialTransaction;
import com.flagship.club_ledger.transaction.TransactionKind;
import com.flagship.club_ledger.transaction.TransactionLedgerStore;
import com.flagship.club_ledger.transaction.TransactionLedgerStore.SettlementOutcome;
import com.flagship.club_ledger.transaction.TransactionStatus;
import com.flagship.club_ledger.payment.purpose.PaymentPurpose;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Records payments in two steps.
 *
 * The initiation notification writes a PROCESSING row with the gross amount
 * and zero fees. The settlement notification completes it with fee and net
 * figures fetched from the processor's settlement record. Either may arrive
 * first; a settlement with no prior row creates the payment directly as
 * COMPLETED.
 *
 * Each ledger write commits on its own, before side effects run.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TwoPhaseRecorder {

    private final TransactionLedgerStore ledgerStore;
    private final PaymentProcessorClient processorClient;
    private final PaymentMetadataDecoder metadataDecoder;
    private final PaymentSideEffectHook sideEffectHook;
    private final AccountFeeLockService feeLockService;
    private final ReceiptNotifier receiptNotifier;
    private final LedgerMetrics metrics;
    private final Clock clock;

    /**
     * Handles a paid checkout. The provisional ledger row is written only for
     * organizer payments not yet recorded; the account fee lock and the domain
     * side effect are applied for every paid checkout, including platform
     * purchases and payments whose settlement arrived first.
     */
    public RecordingOutcome onInitiationNotified(CheckoutSessionSnapshot session, ProcessorEvent event) {
        if (!session.isPaid()) {
            return skip(event, "not_paid", "Checkout {} not paid (status={})", session.sessionId(), session.paymentStatus());
        }
        PaymentMetadata metadata = metadataDecoder.decode(session.metadata());
        if (session.paymentIntentId() != null) {
            MDC.put(CorrelationContext.PAYMENT_INTENT_MDC_KEY, session.paymentIntentId());
        }

        RecordingOutcome outcome = recordProvisionalPayment(session, metadata, event);

        confirmFeeLock(metadata);
        sideEffectHook.applyPaymentSideEffect(metadata.purpose(), metadata, session.amountTotal());
        return outcome;
    }

    private RecordingOutcome recordProvisionalPayment(CheckoutSessionSnapshot session, PaymentMetadata metadata,
                                                      ProcessorEvent event) {
        if (!event.targetsReceivingAccount()) {
            return skip(event, "platform_account", "Checkout {} is on the platform account", session.sessionId());
        }
        if (!metadata.hasOrganizer()) {
            return skip(event, "no_organizer", "Checkout {} metadata names no organizer", session.sessionId());
        }
        if (metadata.purpose().isPlatformOnly()) {
            return skip(event, "platform_only", "Checkout {} is a platform purchase ({})",
                    session.sessionId(), metadata.purpose().typeCode());
        }
        if (session.paymentIntentId() == null) {
            return skip(event, "no_payment_intent", "Checkout {} has no payment intent", session.sessionId());
        }

        FinancialTransaction row = basePayment(metadata, event)
                .status(TransactionStatus.PROCESSING)
                .amount(session.amountTotal())
                .currency(FinancialTransaction.canonicalCurrency(session.currency()))
                .paymentIntentId(session.paymentIntentId())
                .checkoutSessionId(session.sessionId())
                .build();

        Optional<FinancialTransaction> recorded = ledgerStore.recordInitiation(row);
        if (recorded.isEmpty()) {
            return RecordingOutcome.ALREADY_RECORDED;
        }
        FinancialTransaction payment = recorded.get();
        MDC.put(CorrelationContext.TRANSACTION_ID_MDC_KEY, payment.getId().toString());
        metrics.recordPaymentRecorded("initiation", payment.getCurrency());
        log.info("Payment {} initiated: {} {} for {} '{}'",
                payment.getId(), payment.getAmount(), payment.getCurrency(),
                metadata.purpose().typeCode(), metadata.eventName());
        return RecordingOutcome.RECORDED;
    }

    /**
     * Completes a payment from its settlement record.
     *
     * @throws com.flagship.club_ledger.processor.ProcessorException if the settlement
     *         record cannot be retrieved; the payload's fee estimate is never used instead
     */
    public RecordingOutcome onSettlementNotified(ChargeSnapshot charge, ProcessorEvent event) {
        if (!event.targetsReceivingAccount()) {
            return skip(event, "platform_account", "Charge {} is on the platform account", charge.chargeId());
        }
        String paymentIntentId = charge.paymentIntentId();
        if (paymentIntentId == null) {
            return skip(event, "no_payment_intent", "Charge {} has no payment intent", charge.chargeId());
        }
        MDC.put(CorrelationContext.PAYMENT_INTENT_MDC_KEY, paymentIntentId);

        String account = event.receivingAccountRef();
        SettlementDetails settlement = fetchSettlement(charge.chargeId(), account);
        Instant now = clock.instant();

        FinancialTransaction completedRow = null;
        PaymentMetadata metadata = null;
        if (ledgerStore.findPaymentByPaymentIntent(paymentIntentId).isEmpty()) {
            metadata = resolveSettlementMetadata(charge, account);
            if (!metadata.hasOrganizer()) {
                log.warn("Charge {} settled with no recorded payment and no organizer in metadata", charge.chargeId());
            } else if (metadata.purpose().isPlatformOnly()) {
                return skip(event, "platform_only", "Charge {} is a platform purchase", charge.chargeId());
            } else {
                completedRow = basePayment(metadata, event)
                        .status(TransactionStatus.COMPLETED)
                        .amount(charge.amount())
                        .currency(FinancialTransaction.canonicalCurrency(charge.currency()))
                        .paymentIntentId(paymentIntentId)
                        .chargeId(charge.chargeId())
                        .settlementId(settlement.settlementId())
                        .platformFee(settlement.applicationFee())
                        .totalFee(settlement.totalFee())
                        .netAmount(settlement.netAmount())
                        .applicationFeeId(charge.applicationFeeId())
                        .paymentMethodType(charge.paymentMethodType())
                        .cardLast4(charge.cardLast4())
                        .completedAt(now)
                        .build();
            }
        }

        AtomicBoolean alreadySettled = new AtomicBoolean(false);
        SettlementOutcome outcome = ledgerStore.recordSettlement(paymentIntentId, existing -> {
            checkAccount(existing, account);
            checkGross(existing, settlement);
            if (existing.getStatus() != TransactionStatus.PROCESSING) {
                alreadySettled.set(true);
                log.info("Payment {} already {}, settlement not reapplied", existing.getId(), existing.getStatus());
                return existing;
            }
            return existing.settle(settlement, charge.chargeId(), now).toBuilder()
                    .applicationFeeId(charge.applicationFeeId())
                    .paymentMethodType(charge.paymentMethodType())
                    .cardLast4(charge.cardLast4())
                    .build();
        }, completedRow);

        if (outcome.created()) {
            confirmFeeLock(metadata);
        }
        if (outcome.skipped()) {
            metrics.recordSkipped(event.type(), "no_organizer");
            return RecordingOutcome.SKIPPED;
        }
        if (alreadySettled.get()) {
            return RecordingOutcome.ALREADY_RECORDED;
        }

        FinancialTransaction payment = outcome.transaction();
        MDC.put(CorrelationContext.TRANSACTION_ID_MDC_KEY, payment.getId().toString());
        metrics.recordPaymentRecorded("settlement", payment.getCurrency());
        log.info("Payment {} completed: gross={}, platformFee={}, totalFee={}, net={}",
                payment.getId(), payment.getAmount(), payment.getPlatformFee(),
                payment.getTotalFee(), payment.getNetAmount());

        receiptNotifier.notifyReceipt(PaymentReceipt.from(payment));
        return RecordingOutcome.RECORDED;
    }

    // Idempotent; whichever of initiation and settlement comes first confirms the lock
    private void confirmFeeLock(PaymentMetadata metadata) {
        if (metadata.hasAccountFeeLock()) {
            feeLockService.confirm(metadata.accountFeeLockId());
        }
    }

    private SettlementDetails fetchSettlement(String chargeId, String account) {
        long start = System.currentTimeMillis();
        try {
            SettlementDetails settlement = processorClient.fetchSettlement(chargeId, account);
            metrics.recordProcessorCall("fetch_settlement", "success", System.currentTimeMillis() - start);
            return settlement;
        } catch (RuntimeException e) {
            metrics.recordProcessorCall("fetch_settlement", "error", System.currentTimeMillis() - start);
            log.error("Settlement lookup failed for charge {}: {}", chargeId, e.getMessage());
            throw e;
        }
    }

    /**
     * Charge metadata first; if it names no organizer, the payment intent's metadata.
     */
    private PaymentMetadata resolveSettlementMetadata(ChargeSnapshot charge, String account) {
        PaymentMetadata fromCharge = metadataDecoder.decode(charge.metadata());
        if (fromCharge.hasOrganizer()) {
            return fromCharge;
        }
        PaymentIntentSnapshot intent = processorClient.fetchPaymentIntent(charge.paymentIntentId(), account);
        log.debug("Using payment intent {} metadata for charge {}", intent.paymentIntentId(), charge.chargeId());
        return metadataDecoder.decode(intent.metadata());
    }

    private FinancialTransaction.FinancialTransactionBuilder basePayment(PaymentMetadata metadata, ProcessorEvent event) {
        PaymentPurpose purpose = metadata.purpose();
        return FinancialTransaction.builder()
                .id(UUID.randomUUID())
                .kind(TransactionKind.PAYMENT)
                .receivingAccountRef(event.receivingAccountRef())
                .organizerRef(metadata.organizerRef())
                .payerRef(metadata.payerRef())
                .payerName(metadata.payerName())
                .payerEmail(metadata.payerEmail())
                .purposeType(purpose.typeCode())
                .referenceId(metadata.referenceId())
                .referenceName(metadata.eventName())
                .livemode(event.livemode())
                .webhookEventId(event.id());
    }

    private void checkAccount(FinancialTransaction existing, String account) {
        if (existing.getReceivingAccountRef() != null && !Objects.equals(existing.getReceivingAccountRef(), account)) {
            log.warn("Receiving account mismatch for payment {}: recorded={}, settlement={}",
                    existing.getId(), existing.getReceivingAccountRef(), account);
            metrics.recordReconciliationMismatch("receiving_account");
        }
    }

    private void checkGross(FinancialTransaction existing, SettlementDetails settlement) {
        if (settlement.grossAmount() != existing.getAmount()) {
            log.warn("Gross mismatch for payment {}: recorded={}, settlement={}",
                    existing.getId(), existing.getAmount(), settlement.grossAmount());
            metrics.recordReconciliationMismatch("gross_amount");
        }
    }

    private RecordingOutcome skip(ProcessorEvent event, String reason, String message, Object... args) {
        log.info(message, args);
        metrics.recordSkipped(event.type(), reason);
        return RecordingOutcome.SKIPPED;
    }
}

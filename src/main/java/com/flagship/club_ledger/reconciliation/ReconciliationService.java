package com.flagship.club_ledger.reconciliation;

import com.flagship.club_ledger.config.LedgerProperties;
import com.flagship.club_ledger.observability.LedgerMetrics;
import com.flagship.club_ledger.payment.RecordingOutcome;
import com.flagship.club_ledger.payment.TwoPhaseRecorder;
import com.flagship.club_ledger.processor.BalanceEntry;
import com.flagship.club_ledger.processor.PaymentProcessorClient;
import com.flagship.club_ledger.processor.ProcessorCharge;
import com.flagship.club_ledger.processor.ProcessorEvent;
import com.flagship.club_ledger.transaction.FinancialTransaction;
import com.flagship.club_ledger.transaction.TransactionKind;
import com.flagship.club_ledger.transaction.TransactionLedgerStore;
import com.flagship.club_ledger.transaction.TransactionStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Compares the ledger for one receiving account with what the processor
 * reports for the same window, and records charges the ledger missed.
 *
 * Runs are read-only. Repairing a MISSING_IN_LEDGER charge goes through
 * {@link #addMissingPayment}, which replays the charge through the normal
 * settlement path so the row carries the processor's settled fees.
 */
@Service
@Slf4j
public class ReconciliationService {

    static final String REMEDIATION_EVENT_PREFIX = "reconciliation:";

    private static final Set<TransactionStatus> SETTLED_PAYMENT_STATUSES =
            EnumSet.of(TransactionStatus.COMPLETED, TransactionStatus.PARTIALLY_REFUNDED);
    private static final Set<TransactionStatus> SETTLED_STATUSES =
            EnumSet.of(TransactionStatus.COMPLETED, TransactionStatus.PARTIALLY_REFUNDED, TransactionStatus.REFUNDED);

    private final PaymentProcessorClient processorClient;
    private final TransactionLedgerStore ledgerStore;
    private final TwoPhaseRecorder recorder;
    private final LedgerProperties.Reconciliation settings;
    private final LedgerMetrics metrics;
    private final Clock clock;

    public ReconciliationService(PaymentProcessorClient processorClient, TransactionLedgerStore ledgerStore,
                                 TwoPhaseRecorder recorder, LedgerProperties properties,
                                 LedgerMetrics metrics, Clock clock) {
        this.processorClient = processorClient;
        this.ledgerStore = ledgerStore;
        this.recorder = recorder;
        this.settings = properties.getReconciliation();
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Settled charges on the account against its COMPLETED and PARTIALLY_REFUNDED
     * payments, matched by charge id and compared on gross. A charge recorded
     * under another account is an ACCOUNT_MISMATCH and still counts as matched.
     *
     * @throws IllegalArgumentException if the account or window is invalid
     */
    public ReconciliationReport reconcileCharges(String receivingAccountRef, Instant from, Instant to) {
        validateWindow(receivingAccountRef, from, to);

        List<ProcessorCharge> charges = processorClient.listCharges(receivingAccountRef, from, to).stream()
                .filter(ProcessorCharge::isSettledPayment)
                .toList();
        Map<String, FinancialTransaction> unmatched = new LinkedHashMap<>();
        for (FinancialTransaction payment : ledgerStore.findForAccount(
                receivingAccountRef, TransactionKind.PAYMENT, SETTLED_PAYMENT_STATUSES, from, to)) {
            if (payment.getChargeId() != null) {
                unmatched.put(payment.getChargeId(), payment);
            }
        }

        Tally tally = new Tally();
        for (ProcessorCharge charge : charges) {
            tally.processorTotal += charge.amount();
            FinancialTransaction recorded = unmatched.remove(charge.chargeId());
            if (recorded == null) {
                Optional<FinancialTransaction> elsewhere = ledgerStore.findPaymentByCharge(charge.chargeId());
                if (elsewhere.isEmpty()) {
                    tally.add(Discrepancy.missingInLedger(charge.chargeId(), null, charge.amount(),
                            charge.createdAt(), "Settled charge has no ledger payment", true));
                    continue;
                }
                recorded = elsewhere.get();
                if (!receivingAccountRef.equals(recorded.getReceivingAccountRef())) {
                    tally.ledgerTotal += recorded.getAmount();
                    tally.add(Discrepancy.accountMismatch(charge.chargeId(), recorded.getId(),
                            charge.amount(), charge.createdAt(), recorded.getReceivingAccountRef()));
                    continue;
                }
            }
            // Recorded on this account, possibly outside the window or in another settled status
            tally.ledgerTotal += recorded.getAmount();
            compare(tally, charge.chargeId(), null, recorded, charge.amount(), recorded.getAmount(), charge.createdAt());
        }

        for (FinancialTransaction payment : unmatched.values()) {
            tally.ledgerTotal += payment.getAmount();
            tally.add(Discrepancy.missingInProcessor(payment.getChargeId(), payment.getId(), payment.getAmount(),
                    payment.getCreatedAt(), "Ledger payment has no settled charge on the processor"));
        }

        return finish(ReconciliationMode.CHARGES, receivingAccountRef, from, to, tally, charges.size());
    }

    /**
     * Balance movements on the account against settled ledger rows of any kind,
     * matched by settlement id, then by the charge or refund behind the movement,
     * and compared on net. Payouts, fees and adjustments are counted but ignored.
     *
     * @throws IllegalArgumentException if the account or window is invalid
     */
    public ReconciliationReport reconcileSettlements(String receivingAccountRef, Instant from, Instant to) {
        validateWindow(receivingAccountRef, from, to);

        List<BalanceEntry> entries = processorClient.listBalanceEntries(receivingAccountRef, from, to);
        List<FinancialTransaction> rows = ledgerStore.findForAccount(
                receivingAccountRef, null, SETTLED_STATUSES, from, to);

        Map<String, FinancialTransaction> bySettlement = new HashMap<>();
        Map<String, FinancialTransaction> byCharge = new HashMap<>();
        Map<String, FinancialTransaction> byRefund = new HashMap<>();
        for (FinancialTransaction row : rows) {
            if (row.getSettlementId() != null) {
                bySettlement.put(row.getSettlementId(), row);
            }
            if (row.getKind() == TransactionKind.PAYMENT && row.getChargeId() != null) {
                byCharge.put(row.getChargeId(), row);
            }
            if (row.getKind() == TransactionKind.REFUND && row.getRefundId() != null) {
                byRefund.put(row.getRefundId(), row);
            }
        }

        Tally tally = new Tally();
        Set<String> listedEntryIds = new HashSet<>();
        Set<UUID> matchedRows = new HashSet<>();
        for (BalanceEntry entry : entries) {
            if (!entry.isLedgerMovement()) {
                tally.ignoredTypes.merge(entry.type(), 1, Integer::sum);
                continue;
            }
            listedEntryIds.add(entry.id());
            tally.processorTotal += entry.net();

            FinancialTransaction row = bySettlement.get(entry.id());
            if (row == null && entry.sourceId() != null) {
                row = "refund".equals(entry.type()) ? byRefund.get(entry.sourceId()) : byCharge.get(entry.sourceId());
            }
            if (row == null || !matchedRows.add(row.getId())) {
                tally.add(Discrepancy.missingInLedger(entry.id(), entry.sourceId(), entry.net(), entry.createdAt(),
                        "Balance " + entry.type() + " has no ledger row",
                        !"refund".equals(entry.type()) && entry.sourceId() != null));
                continue;
            }
            tally.ledgerTotal += row.getNetAmount();
            compare(tally, entry.id(), entry.sourceId(), row, entry.net(), row.getNetAmount(), entry.createdAt());
        }

        // Only rows that carry a settlement id can be checked from this side
        for (FinancialTransaction row : rows) {
            if (row.getSettlementId() == null || matchedRows.contains(row.getId())
                    || listedEntryIds.contains(row.getSettlementId())) {
                continue;
            }
            tally.ledgerTotal += row.getNetAmount();
            tally.add(Discrepancy.missingInProcessor(row.getSettlementId(), row.getId(), row.getNetAmount(),
                    row.getCreatedAt(), "Ledger " + row.getKind() + " settlement is not on the processor balance"));
        }

        int ignored = tally.ignoredTypes.values().stream().mapToInt(Integer::intValue).sum();
        return finish(ReconciliationMode.SETTLEMENTS, receivingAccountRef, from, to, tally, entries.size() - ignored);
    }

    /**
     * Records a settled charge the ledger has no payment for, using the
     * charge's metadata and the processor's settlement record.
     *
     * @return the recorded payment
     * @throws IllegalStateException if the charge is already recorded, has not
     *         succeeded, or is not an organizer payment
     */
    public FinancialTransaction addMissingPayment(String receivingAccountRef, String chargeId, String requestedBy) {
        if (receivingAccountRef == null || receivingAccountRef.isBlank() || chargeId == null || chargeId.isBlank()) {
            throw new IllegalArgumentException("receivingAccountRef and chargeId are required");
        }
        ledgerStore.findPaymentByCharge(chargeId).ifPresent(existing -> {
            throw new IllegalStateException(String.format(
                    "Charge %s is already recorded as transaction %s", chargeId, existing.getId()));
        });

        ProcessorCharge charge = processorClient.fetchCharge(chargeId, receivingAccountRef);
        if (!charge.isSucceeded()) {
            throw new IllegalStateException(String.format("Charge %s is %s, not %s",
                    chargeId, charge.status(), ProcessorCharge.SUCCEEDED));
        }

        ProcessorEvent replay = new ProcessorEvent(REMEDIATION_EVENT_PREFIX + chargeId,
                ProcessorEvent.CHARGE_SUCCEEDED, receivingAccountRef, charge.livemode(),
                clock.instant(), charge.charge());
        RecordingOutcome outcome = recorder.onSettlementNotified(charge.charge(), replay);
        if (outcome == RecordingOutcome.SKIPPED) {
            throw new IllegalStateException("Charge " + chargeId + " is not an organizer payment; nothing recorded");
        }

        FinancialTransaction payment = ledgerStore.findPaymentByCharge(chargeId)
                .or(() -> Optional.ofNullable(charge.charge().paymentIntentId())
                        .flatMap(ledgerStore::findPaymentByPaymentIntent))
                .orElseThrow(() -> new IllegalStateException("Charge " + chargeId + " was not recorded"));
        log.info("Added missing payment {} for charge {} on {} (requested by {}, outcome={})",
                payment.getId(), chargeId, receivingAccountRef, requestedBy, outcome);
        return payment;
    }

    private void validateWindow(String receivingAccountRef, Instant from, Instant to) {
        if (receivingAccountRef == null || receivingAccountRef.isBlank()) {
            throw new IllegalArgumentException("receivingAccountRef is required");
        }
        if (from == null || to == null || !from.isBefore(to)) {
            throw new IllegalArgumentException("from must be before to");
        }
        if (Duration.between(from, to).compareTo(settings.getMaxRange()) > 0) {
            throw new IllegalArgumentException("Window exceeds " + settings.getMaxRange().toDays() + " days");
        }
    }

    private void compare(Tally tally, String processorRef, String sourceRef, FinancialTransaction row,
                         long processorAmount, long ledgerAmount, Instant occurredAt) {
        if (Math.abs(processorAmount - ledgerAmount) > settings.getAmountTolerance()) {
            tally.add(Discrepancy.amountMismatch(processorRef, sourceRef, row.getId(),
                    processorAmount, ledgerAmount, occurredAt));
        } else {
            tally.matched++;
        }
    }

    private ReconciliationReport finish(ReconciliationMode mode, String receivingAccountRef,
                                        Instant from, Instant to, Tally tally, int compared) {
        Map<DiscrepancyType, Integer> counts = new EnumMap<>(DiscrepancyType.class);
        for (Discrepancy discrepancy : tally.discrepancies) {
            counts.merge(discrepancy.type(), 1, Integer::sum);
            metrics.recordReconciliationMismatch(discrepancy.type().metricField());
        }
        int accountMismatches = counts.getOrDefault(DiscrepancyType.ACCOUNT_MISMATCH, 0);
        double matchRate = compared == 0
                ? 100.0
                : Math.round((tally.matched + accountMismatches) * 1000.0 / compared) / 10.0;
        int ignored = tally.ignoredTypes.values().stream().mapToInt(Integer::intValue).sum();

        ReconciliationSummary summary = new ReconciliationSummary(
                tally.processorTotal, tally.ledgerTotal, tally.processorTotal - tally.ledgerTotal,
                compared, tally.matched,
                counts.getOrDefault(DiscrepancyType.MISSING_IN_LEDGER, 0),
                counts.getOrDefault(DiscrepancyType.MISSING_IN_PROCESSOR, 0),
                counts.getOrDefault(DiscrepancyType.AMOUNT_MISMATCH, 0),
                accountMismatches, ignored, Map.copyOf(tally.ignoredTypes), matchRate);

        log.info("{} reconciliation for {} [{} - {}]: compared={}, matched={}, discrepancies={}, matchRate={}",
                mode, receivingAccountRef, from, to, compared, tally.matched, tally.discrepancies.size(), matchRate);
        return new ReconciliationReport(mode, receivingAccountRef, from, to, summary,
                List.copyOf(tally.discrepancies), clock.instant());
    }

    private static final class Tally {
        private final List<Discrepancy> discrepancies = new ArrayList<>();
        private final Map<String, Integer> ignoredTypes = new TreeMap<>();
        private long processorTotal;
        private long ledgerTotal;
        private int matched;

        void add(Discrepancy discrepancy) {
            discrepancies.add(discrepancy);
        }
    }
}

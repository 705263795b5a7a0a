package com.flagship.club_ledger.refund;

import com.flagship.club_ledger.LedgerIntegrationTestSupport;
import com.flagship.club_ledger.payment.RecordingOutcome;
import com.flagship.club_ledger.payment.TwoPhaseRecorder;
import com.flagship.club_ledger.processor.ChargeSnapshot;
import com.flagship.club_ledger.processor.CheckoutSessionSnapshot;
import com.flagship.club_ledger.processor.IssuedRefund;
import com.flagship.club_ledger.processor.ProcessorEvent;
import com.flagship.club_ledger.processor.RefundInstruction;
import com.flagship.club_ledger.processor.RefundSnapshot;
import com.flagship.club_ledger.transaction.FinancialTransaction;
import com.flagship.club_ledger.transaction.TransactionKind;
import com.flagship.club_ledger.transaction.TransactionLedgerStore;
import com.flagship.club_ledger.transaction.TransactionStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static com.flagship.club_ledger.LedgerFixtures.charge;
import static com.flagship.club_ledger.LedgerFixtures.event;
import static com.flagship.club_ledger.LedgerFixtures.meetupMetadata;
import static com.flagship.club_ledger.LedgerFixtures.paidCheckout;
import static com.flagship.club_ledger.LedgerFixtures.refundedCharge;
import static com.flagship.club_ledger.LedgerFixtures.standardSettlement;
import static com.flagship.club_ledger.LedgerFixtures.succeededRefund;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Refund requests, confirmations and externally issued refunds against a
 * completed 5000 payment.
 */
class RefundTrackerTest extends LedgerIntegrationTestSupport {

    @Autowired
    private RefundTracker refundTracker;

    @Autowired
    private TwoPhaseRecorder recorder;

    @Autowired
    private TransactionLedgerStore ledgerStore;

    private String account;
    private String paymentIntentId;
    private String chargeId;
    private FinancialTransaction payment;

    @BeforeEach
    void setUp() {
        account = uniqueId("acct");
        paymentIntentId = uniqueId("pi");
        chargeId = uniqueId("ch");
        payment = completedPayment();
    }

    private FinancialTransaction completedPayment() {
        Map<String, String> metadata = meetupMetadata(uniqueId("club"), "meetup-9");
        ProcessorEvent checkout = event(ProcessorEvent.CHECKOUT_COMPLETED, account,
                paidCheckout(paymentIntentId, 5000, metadata));
        recorder.onInitiationNotified((CheckoutSessionSnapshot) checkout.payload(), checkout);

        when(processorClient.fetchSettlement(chargeId, account)).thenReturn(standardSettlement());
        ProcessorEvent settled = event(ProcessorEvent.CHARGE_SUCCEEDED, account,
                charge(chargeId, paymentIntentId, 5000, metadata));
        recorder.onSettlementNotified((ChargeSnapshot) settled.payload(), settled);
        return ledgerStore.findPaymentByPaymentIntent(paymentIntentId).orElseThrow();
    }

    private RecordingOutcome notifyRefunds(List<RefundSnapshot> refunds) {
        ProcessorEvent refunded = event(ProcessorEvent.CHARGE_REFUNDED, account,
                refundedCharge(chargeId, paymentIntentId, 5000, refunds));
        return refundTracker.onRefundNotified((ChargeSnapshot) refunded.payload(), refunded);
    }

    private long refundRows() {
        Long count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM transactions WHERE parent_transaction_id = ? AND kind = 'REFUND'",
                Long.class, payment.getId());
        return count == null ? 0 : count;
    }

    @Test
    @DisplayName("Requested refund is PROCESSING until the refund notification confirms it")
    void testRequestedRefundConfirmed() {
        printTestHeader("Requested Refund Confirmed");

        String refundId = uniqueId("re");
        when(processorClient.issueRefund(any(RefundInstruction.class)))
                .thenReturn(new IssuedRefund(refundId, 2000, "pending"));
        printInput("Payment", payment.getId());
        printInput("Refund amount", 2000);

        RefundResult result = refundTracker.createRefund(payment.getId(), 2000L, "Event cancelled", "admin_1");
        printOutput("Result", result);

        assertEquals(refundId, result.refundId());
        assertEquals(TransactionStatus.PROCESSING, result.status());
        verify(processorClient).issueRefund(new RefundInstruction(chargeId, account, 2000, "Event cancelled"));

        FinancialTransaction pending = ledgerStore.findByRefundId(refundId).orElseThrow();
        assertEquals(TransactionKind.REFUND, pending.getKind());
        assertEquals(-2000, pending.getAmount());
        assertEquals(-30, pending.getPlatformFee());
        assertTrue(pending.isFeeRefundEstimated());
        assertEquals("admin_1", pending.getInitiatedBy());
        assertEquals(TransactionStatus.COMPLETED,
                ledgerStore.findById(payment.getId()).orElseThrow().getStatus());

        assertEquals(RecordingOutcome.RECORDED, notifyRefunds(List.of(succeededRefund(refundId, 2000))));

        FinancialTransaction confirmed = ledgerStore.findByRefundId(refundId).orElseThrow();
        FinancialTransaction parent = ledgerStore.findById(payment.getId()).orElseThrow();
        printOutput("Refund status", confirmed.getStatus());
        printOutput("Payment status", parent.getStatus());
        assertEquals(pending.getId(), confirmed.getId());
        assertEquals(TransactionStatus.COMPLETED, confirmed.getStatus());
        assertNotNull(confirmed.getCompletedAt());
        assertEquals(TransactionStatus.PARTIALLY_REFUNDED, parent.getStatus());
        assertEquals(1, refundRows());

        // Redelivery of the same notification changes nothing
        assertEquals(RecordingOutcome.ALREADY_RECORDED, notifyRefunds(List.of(succeededRefund(refundId, 2000))));
        assertEquals(1, refundRows());
        printSuccess("Refund confirmed and payment partially refunded");
    }

    @Test
    @DisplayName("Refunds issued outside the API are recorded as COMPLETED and can fully refund the payment")
    void testExternalRefunds() {
        printTestHeader("External Refunds");

        String first = uniqueId("re");
        String second = uniqueId("re");

        assertEquals(RecordingOutcome.RECORDED, notifyRefunds(List.of(succeededRefund(first, 1500))));
        assertEquals(TransactionStatus.PARTIALLY_REFUNDED,
                ledgerStore.findById(payment.getId()).orElseThrow().getStatus());

        // Cumulative list on the next notification
        assertEquals(RecordingOutcome.RECORDED, notifyRefunds(List.of(
                succeededRefund(first, 1500), succeededRefund(second, 3500))));

        FinancialTransaction parent = ledgerStore.findById(payment.getId()).orElseThrow();
        printOutput("Payment status", parent.getStatus());
        printOutput("Refunded", ledgerStore.sumCompletedRefunds(payment.getId()));
        assertEquals(TransactionStatus.REFUNDED, parent.getStatus());
        assertEquals(5000, ledgerStore.sumCompletedRefunds(payment.getId()));
        assertEquals(2, refundRows());

        FinancialTransaction external = ledgerStore.findByRefundId(second).orElseThrow();
        assertEquals(TransactionStatus.COMPLETED, external.getStatus());
        assertNotNull(external.getWebhookEventId());
        assertEquals(payment.getId(), external.getParentTransactionId());
        printSuccess("External refunds recorded");
    }

    @Test
    @DisplayName("Refund list is fetched from the processor when the notification omits it")
    void testRefundListFetched() {
        printTestHeader("Refund List Fetched");

        String refundId = uniqueId("re");
        when(processorClient.listRefunds(chargeId, account)).thenReturn(List.of(succeededRefund(refundId, 5000)));

        assertEquals(RecordingOutcome.RECORDED, notifyRefunds(null));

        verify(processorClient).listRefunds(chargeId, account);
        assertEquals(TransactionStatus.REFUNDED, ledgerStore.findById(payment.getId()).orElseThrow().getStatus());
        printSuccess("Refunds fetched and applied");
    }

    @Test
    @DisplayName("Refunds beyond the gross are rejected and nothing is applied")
    void testOvershootRejected() {
        printTestHeader("Refund Overshoot");

        List<RefundSnapshot> refunds = List.of(
                succeededRefund(uniqueId("re"), 4000),
                succeededRefund(uniqueId("re"), 2000));

        IllegalStateException ex = assertThrows(IllegalStateException.class, () -> notifyRefunds(refunds));
        printExpectedException("IllegalStateException", ex.getMessage());

        assertEquals(0, refundRows());
        assertEquals(TransactionStatus.COMPLETED, ledgerStore.findById(payment.getId()).orElseThrow().getStatus());
        printSuccess("Overshoot rolled back");
    }

    @Test
    @DisplayName("A failed refund marks the pending row FAILED and frees the balance")
    void testFailedRefund() {
        printTestHeader("Failed Refund");

        String refundId = uniqueId("re");
        when(processorClient.issueRefund(any(RefundInstruction.class)))
                .thenReturn(new IssuedRefund(refundId, 5000, "pending"));
        refundTracker.createRefund(payment.getId(), null, null, "admin_1");

        assertEquals(RecordingOutcome.ALREADY_RECORDED,
                notifyRefunds(List.of(new RefundSnapshot(refundId, 5000, "failed"))));

        assertEquals(TransactionStatus.FAILED, ledgerStore.findByRefundId(refundId).orElseThrow().getStatus());
        assertEquals(TransactionStatus.COMPLETED, ledgerStore.findById(payment.getId()).orElseThrow().getStatus());
        assertEquals(0, ledgerStore.sumPendingRefunds(payment.getId()));
        printSuccess("Failed refund recorded");
    }

    @Test
    @DisplayName("Invalid refund requests never reach the processor")
    void testInvalidRequests() {
        printTestHeader("Invalid Refund Requests");

        String refundId = uniqueId("re");
        when(processorClient.issueRefund(any(RefundInstruction.class)))
                .thenReturn(new IssuedRefund(refundId, 3000, "pending"));
        refundTracker.createRefund(payment.getId(), 3000L, null, "admin_1");

        // 3000 pending leaves 2000 refundable
        InvalidRefundRequestException overBalance = assertThrows(InvalidRefundRequestException.class,
                () -> refundTracker.createRefund(payment.getId(), 2500L, null, "admin_1"));
        printExpectedException("InvalidRefundRequestException", overBalance.getMessage());

        assertThrows(InvalidRefundRequestException.class,
                () -> refundTracker.createRefund(payment.getId(), 6000L, null, "admin_1"));
        assertThrows(InvalidRefundRequestException.class,
                () -> refundTracker.createRefund(payment.getId(), 0L, null, "admin_1"));
        assertThrows(InvalidRefundRequestException.class,
                () -> refundTracker.createRefund(UUID.randomUUID(), 100L, null, "admin_1"));

        FinancialTransaction refundRow = ledgerStore.findByRefundId(refundId).orElseThrow();
        assertThrows(InvalidRefundRequestException.class,
                () -> refundTracker.createRefund(refundRow.getId(), 100L, null, "admin_1"));

        verify(processorClient, times(1)).issueRefund(any(RefundInstruction.class));
        printSuccess("Processor called only for the valid request");
    }

    @Test
    @DisplayName("A payment still PROCESSING cannot be refunded")
    void testProcessingPaymentNotRefundable() {
        printTestHeader("Processing Payment Not Refundable");

        String otherIntent = uniqueId("pi");
        ProcessorEvent checkout = event(ProcessorEvent.CHECKOUT_COMPLETED, account,
                paidCheckout(otherIntent, 1200, meetupMetadata(uniqueId("club"), "meetup-2")));
        recorder.onInitiationNotified((CheckoutSessionSnapshot) checkout.payload(), checkout);
        FinancialTransaction processing = ledgerStore.findPaymentByPaymentIntent(otherIntent).orElseThrow();

        assertThrows(InvalidRefundRequestException.class,
                () -> refundTracker.createRefund(processing.getId(), 500L, null, "admin_1"));
        verify(processorClient, never()).issueRefund(any(RefundInstruction.class));
        printSuccess("Only settled payments are refundable");
    }
}

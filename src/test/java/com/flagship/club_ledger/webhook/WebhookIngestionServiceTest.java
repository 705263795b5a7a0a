package com.flagship.club_ledger.webhook;

import com.flagship.club_ledger.LedgerIntegrationTestSupport;
import com.flagship.club_ledger.processor.EventPayload;
import com.flagship.club_ledger.processor.InvalidSignatureException;
import com.flagship.club_ledger.processor.ProcessorEvent;
import com.flagship.club_ledger.processor.ProcessorException;
import com.flagship.club_ledger.transaction.TransactionLedgerStore;
import com.flagship.club_ledger.transaction.TransactionStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Instant;
import java.util.Map;

import static com.flagship.club_ledger.LedgerFixtures.charge;
import static com.flagship.club_ledger.LedgerFixtures.meetupMetadata;
import static com.flagship.club_ledger.LedgerFixtures.paidCheckout;
import static com.flagship.club_ledger.LedgerFixtures.standardSettlement;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * End-to-end ingestion: verify, claim, route, mark.
 */
class WebhookIngestionServiceTest extends LedgerIntegrationTestSupport {

    private static final String SIGNATURE = "t=1,v1=test";

    @Autowired
    private WebhookIngestionService ingestionService;

    @Autowired
    private IdempotencyGate idempotencyGate;

    @Autowired
    private TransactionLedgerStore ledgerStore;

    private String account;
    private String paymentIntentId;

    @BeforeEach
    void setUp() {
        account = uniqueId("acct");
        paymentIntentId = uniqueId("pi");
    }

    private ProcessorEvent stubVerifiedEvent(String payload, String type, EventPayload eventPayload) {
        ProcessorEvent event = new ProcessorEvent(uniqueId("evt"), type, account, false, Instant.now(), eventPayload);
        when(webhookVerifier.verify(eq(payload), eq(SIGNATURE), anyString())).thenReturn(event);
        return event;
    }

    @Test
    @DisplayName("Same event delivered twice is recorded once")
    void testDuplicateDelivery() {
        printTestHeader("Duplicate Delivery");

        Map<String, String> metadata = meetupMetadata(uniqueId("club"), "meetup-1");
        String payload = "{\"checkout\":1}";
        ProcessorEvent event = stubVerifiedEvent(payload, ProcessorEvent.CHECKOUT_COMPLETED,
                paidCheckout(paymentIntentId, 5000, metadata));
        printInput("Event ID", event.id());

        WebhookOutcome first = ingestionService.ingest(payload, SIGNATURE);
        WebhookOutcome second = ingestionService.ingest(payload, SIGNATURE);
        printOutput("First", first);
        printOutput("Second", second);

        assertEquals(WebhookOutcome.PROCESSED, first);
        assertEquals(WebhookOutcome.DUPLICATE, second);
        assertEquals(1, ledgerStore.findByPaymentIntent(paymentIntentId).size());
        assertEquals(PaymentEventStatus.COMPLETED, idempotencyGate.find(event.id()).orElseThrow().getStatus());
        printSuccess("Second delivery was a no-op");
    }

    @Test
    @DisplayName("Handler failure marks the claim FAILED and redelivery is swallowed")
    void testFailureIsTerminal() {
        printTestHeader("Failure Is Terminal");

        String chargeId = uniqueId("ch");
        String payload = "{\"charge\":1}";
        ProcessorEvent event = stubVerifiedEvent(payload, ProcessorEvent.CHARGE_SUCCEEDED,
                charge(chargeId, paymentIntentId, 5000, meetupMetadata(uniqueId("club"), "meetup-2")));
        when(processorClient.fetchSettlement(chargeId, account))
                .thenThrow(new ProcessorException("network unreachable"));

        WebhookProcessingException thrown = assertThrows(WebhookProcessingException.class,
                () -> ingestionService.ingest(payload, SIGNATURE));
        printExpectedException("WebhookProcessingException", thrown.getMessage());
        assertEquals(event.id(), thrown.getEventId());

        PaymentEventRecord record = idempotencyGate.find(event.id()).orElseThrow();
        printOutput("Claim status", record.getStatus());
        assertEquals(PaymentEventStatus.FAILED, record.getStatus());
        assertTrue(record.getError().contains("network unreachable"));

        // Permanent claim: the redelivery is acknowledged without another attempt
        assertEquals(WebhookOutcome.DUPLICATE, ingestionService.ingest(payload, SIGNATURE));
        verify(processorClient, times(1)).fetchSettlement(chargeId, account);
        assertTrue(ledgerStore.findPaymentByPaymentIntent(paymentIntentId).isEmpty());
        printSuccess("Failure recorded, retry suppressed");
    }

    @Test
    @DisplayName("Unhandled event types are claimed and acknowledged")
    void testUnhandledType() {
        printTestHeader("Unhandled Type");

        String payload = "{\"account\":1}";
        ProcessorEvent event = stubVerifiedEvent(payload, "account.updated", new EventPayload.Unhandled("Account"));

        assertEquals(WebhookOutcome.IGNORED, ingestionService.ingest(payload, SIGNATURE));
        assertEquals(PaymentEventStatus.COMPLETED, idempotencyGate.find(event.id()).orElseThrow().getStatus());
        printSuccess("Ignored event completed");
    }

    @Test
    @DisplayName("Signature failure never creates a claim")
    void testInvalidSignature() {
        printTestHeader("Invalid Signature");

        when(webhookVerifier.verify(anyString(), anyString(), anyString()))
                .thenThrow(new InvalidSignatureException("Invalid signature"));

        assertThrows(InvalidSignatureException.class, () -> ingestionService.ingest("{}", "t=1,v1=bad"));
        printExpectedException("InvalidSignatureException", "bad signature");
        printSuccess("Rejected before claiming");
    }

    @Test
    @DisplayName("Full settlement via webhook completes the payment")
    void testSettlementViaWebhook() {
        printTestHeader("Settlement Via Webhook");

        String chargeId = uniqueId("ch");
        Map<String, String> metadata = meetupMetadata(uniqueId("club"), "meetup-3");
        when(processorClient.fetchSettlement(chargeId, account)).thenReturn(standardSettlement());

        String checkoutPayload = "{\"checkout\":2}";
        stubVerifiedEvent(checkoutPayload, ProcessorEvent.CHECKOUT_COMPLETED, paidCheckout(paymentIntentId, 5000, metadata));
        String chargePayload = "{\"charge\":2}";
        stubVerifiedEvent(chargePayload, ProcessorEvent.CHARGE_SUCCEEDED, charge(chargeId, paymentIntentId, 5000, metadata));

        assertEquals(WebhookOutcome.PROCESSED, ingestionService.ingest(checkoutPayload, SIGNATURE));
        assertEquals(WebhookOutcome.PROCESSED, ingestionService.ingest(chargePayload, SIGNATURE));

        var payment = ledgerStore.findPaymentByPaymentIntent(paymentIntentId).orElseThrow();
        printOutput("Status", payment.getStatus());
        assertEquals(TransactionStatus.COMPLETED, payment.getStatus());
        assertEquals(75, payment.getPlatformFee());
        printSuccess("Two-phase recording through the webhook path");
    }
}

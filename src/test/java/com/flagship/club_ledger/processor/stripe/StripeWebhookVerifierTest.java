package com.flagship.club_ledger.processor.stripe;

import com.flagship.club_ledger.processor.ChargeSnapshot;
import com.flagship.club_ledger.processor.CheckoutSessionSnapshot;
import com.flagship.club_ledger.processor.DisputeSnapshot;
import com.flagship.club_ledger.processor.EventPayload;
import com.flagship.club_ledger.processor.InvalidSignatureException;
import com.flagship.club_ledger.processor.ProcessorEvent;
import com.flagship.club_ledger.processor.ProcessorProperties;
import com.stripe.Stripe;
import com.stripe.net.Webhook;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Signature checks and event translation against payloads signed the way
 * the processor signs them.
 */
class StripeWebhookVerifierTest {

    private static final String SECRET = "whsec_unit_test";

    private StripeWebhookVerifier verifier;

    @BeforeEach
    void setUp() {
        ProcessorProperties properties = new ProcessorProperties();
        properties.setSignatureToleranceSeconds(300);
        verifier = new StripeWebhookVerifier(properties);
    }

    private static String sign(String payload, long timestamp, String secret) throws Exception {
        String signature = Webhook.Util.computeHmacSha256(secret, timestamp + "." + payload);
        return "t=" + timestamp + ",v1=" + signature;
    }

    private static String event(String id, String type, String account, String object) {
        return "{"
                + "\"id\":\"" + id + "\","
                + "\"object\":\"event\","
                + "\"api_version\":\"" + Stripe.API_VERSION + "\","
                + "\"created\":1718000000,"
                + "\"livemode\":false,"
                + "\"type\":\"" + type + "\","
                + (account != null ? "\"account\":\"" + account + "\"," : "")
                + "\"data\":{\"object\":" + object + "}"
                + "}";
    }

    @Test
    @DisplayName("Valid signature yields a translated checkout event")
    void testValidCheckoutEvent() throws Exception {
        String payload = event("evt_checkout", "checkout.session.completed", "acct_club",
                "{\"id\":\"cs_1\",\"object\":\"checkout.session\",\"payment_intent\":\"pi_1\","
                        + "\"payment_status\":\"paid\",\"amount_total\":5000,\"currency\":\"nzd\","
                        + "\"metadata\":{\"type\":\"meetup\",\"meetupId\":\"m1\"}}");
        String header = sign(payload, Instant.now().getEpochSecond(), SECRET);

        ProcessorEvent event = verifier.verify(payload, header, SECRET);

        assertEquals("evt_checkout", event.id());
        assertEquals(ProcessorEvent.CHECKOUT_COMPLETED, event.type());
        assertEquals("acct_club", event.receivingAccountRef());
        assertFalse(event.livemode());
        assertEquals(Instant.ofEpochSecond(1718000000), event.createdAt());

        CheckoutSessionSnapshot session = assertInstanceOf(CheckoutSessionSnapshot.class, event.payload());
        assertEquals("pi_1", session.paymentIntentId());
        assertEquals(5000, session.amountTotal());
        assertEquals("m1", session.metadata().get("meetupId"));
    }

    @Test
    @DisplayName("Charge refunds and card details are carried over")
    void testChargeEvent() throws Exception {
        String payload = event("evt_refund", "charge.refunded", "acct_club",
                "{\"id\":\"ch_1\",\"object\":\"charge\",\"payment_intent\":\"pi_1\",\"amount\":5000,"
                        + "\"currency\":\"nzd\",\"refunded\":false,\"amount_refunded\":2000,"
                        + "\"payment_method_details\":{\"type\":\"card\",\"card\":{\"last4\":\"4242\"}},"
                        + "\"refunds\":{\"object\":\"list\",\"data\":[{\"id\":\"re_1\",\"object\":\"refund\","
                        + "\"amount\":2000,\"status\":\"succeeded\"}]}}");
        String header = sign(payload, Instant.now().getEpochSecond(), SECRET);

        ChargeSnapshot charge = assertInstanceOf(ChargeSnapshot.class, verifier.verify(payload, header, SECRET).payload());

        assertEquals("ch_1", charge.chargeId());
        assertEquals(2000, charge.amountRefunded());
        assertEquals("4242", charge.cardLast4());
        assertTrue(charge.hasRefundList());
        assertEquals("re_1", charge.refunds().get(0).refundId());
    }

    @Test
    @DisplayName("Dispute evidence due date is read from evidence details")
    void testDisputeEvent() throws Exception {
        String payload = event("evt_dispute", "charge.dispute.created", "acct_club",
                "{\"id\":\"dp_1\",\"object\":\"dispute\",\"charge\":\"ch_1\",\"amount\":5000,"
                        + "\"status\":\"needs_response\",\"reason\":\"fraudulent\","
                        + "\"evidence_details\":{\"due_by\":1719000000}}");
        String header = sign(payload, Instant.now().getEpochSecond(), SECRET);

        DisputeSnapshot dispute = assertInstanceOf(DisputeSnapshot.class, verifier.verify(payload, header, SECRET).payload());

        assertEquals("ch_1", dispute.chargeId());
        assertEquals(Instant.ofEpochSecond(1719000000), dispute.evidenceDueBy());
    }

    @Test
    @DisplayName("Platform events have no receiving account and unknown objects are unhandled")
    void testPlatformEvent() throws Exception {
        String payload = event("evt_customer", "customer.created", null,
                "{\"id\":\"cus_1\",\"object\":\"customer\"}");
        String header = sign(payload, Instant.now().getEpochSecond(), SECRET);

        ProcessorEvent event = verifier.verify(payload, header, SECRET);

        assertFalse(event.targetsReceivingAccount());
        assertInstanceOf(EventPayload.Unhandled.class, event.payload());
    }

    @Test
    @DisplayName("Tampered body, wrong secret, stale timestamp and missing inputs are rejected")
    void testRejected() throws Exception {
        String payload = event("evt_x", "charge.succeeded", "acct_club", "{\"id\":\"ch_1\",\"object\":\"charge\"}");
        long now = Instant.now().getEpochSecond();
        String header = sign(payload, now, SECRET);

        assertThrows(InvalidSignatureException.class,
                () -> verifier.verify(payload.replace("ch_1", "ch_2"), header, SECRET));
        assertThrows(InvalidSignatureException.class,
                () -> verifier.verify(payload, sign(payload, now, "whsec_other"), SECRET));
        assertThrows(InvalidSignatureException.class,
                () -> verifier.verify(payload, sign(payload, now - 3600, SECRET), SECRET));
        assertThrows(InvalidSignatureException.class, () -> verifier.verify(payload, null, SECRET));
        assertThrows(InvalidSignatureException.class, () -> verifier.verify(payload, header, ""));
    }
}

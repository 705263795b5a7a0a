package com.flagship.club_ledger.webhook;

import com.flagship.club_ledger.LedgerIntegrationTestSupport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.test.context.TestPropertySource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Opt-in reclaiming of FAILED and abandoned claims.
 */
@TestPropertySource(properties = "ledger.idempotency.stale-claim-expiry=PT10M")
class StaleClaimExpiryTest extends LedgerIntegrationTestSupport {

    @Autowired
    private IdempotencyGate idempotencyGate;

    @Test
    @DisplayName("A FAILED claim can be retried by a redelivery")
    void testFailedClaimIsReclaimed() {
        printTestHeader("Failed Claim Reclaimed");

        String eventId = uniqueId("evt");
        assertTrue(idempotencyGate.claim(eventId, "charge.succeeded"));
        idempotencyGate.markFailed(eventId, "timeout");

        assertTrue(idempotencyGate.claim(eventId, "charge.succeeded"));
        PaymentEventRecord record = idempotencyGate.find(eventId).orElseThrow();
        printOutput("Attempts", record.getAttempts());
        assertEquals(PaymentEventStatus.PROCESSING, record.getStatus());
        assertEquals(2, record.getAttempts());
        assertNull(record.getError());
        printSuccess("Redelivery took over the failed claim");
    }

    @Test
    @DisplayName("Only PROCESSING claims older than the expiry are reclaimed")
    void testProcessingClaimExpiry() {
        printTestHeader("Processing Claim Expiry");

        String fresh = uniqueId("evt");
        assertTrue(idempotencyGate.claim(fresh, "charge.succeeded"));
        assertFalse(idempotencyGate.claim(fresh, "charge.succeeded"));

        String abandoned = uniqueId("evt");
        assertTrue(idempotencyGate.claim(abandoned, "charge.succeeded"));
        jdbcTemplate.update("UPDATE payment_events SET claimed_at = now() - interval '1 hour' WHERE id = ?", abandoned);
        assertTrue(idempotencyGate.claim(abandoned, "charge.succeeded"));
        printSuccess("Abandoned claim reclaimed, fresh claim kept");
    }

    @Test
    @DisplayName("COMPLETED claims are never reclaimed")
    void testCompletedClaimIsFinal() {
        printTestHeader("Completed Claim Final");

        String eventId = uniqueId("evt");
        idempotencyGate.claim(eventId, "charge.succeeded");
        idempotencyGate.markComplete(eventId);
        jdbcTemplate.update("UPDATE payment_events SET claimed_at = now() - interval '1 day' WHERE id = ?", eventId);

        assertFalse(idempotencyGate.claim(eventId, "charge.succeeded"));
        printSuccess("Completed stays completed");
    }
}

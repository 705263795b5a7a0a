package com.flagship.club_ledger.observability;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Counters and timers for webhook ingestion and ledger mutations.
 *
 * Tags are limited to event type, outcome and similar low-cardinality values;
 * ids never become tags.
 */
@Component
@RequiredArgsConstructor
public class LedgerMetrics {

    private final MeterRegistry registry;

    public void recordWebhookReceived(String eventType) {
        registry.counter("ledger.webhook.received", "event_type", sanitizeTag(eventType)).increment();
    }

    /**
     * @param outcome one of processed, duplicate, ignored, failed, rejected
     */
    public void recordWebhookOutcome(String eventType, String outcome) {
        registry.counter("ledger.webhook.outcome",
                "event_type", sanitizeTag(eventType),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordWebhookLatency(String eventType, long durationMs) {
        registry.timer("ledger.webhook.latency", "event_type", sanitizeTag(eventType))
                .record(Duration.ofMillis(durationMs));
    }

    public void recordSignatureRejected() {
        registry.counter("ledger.webhook.signature.rejected").increment();
    }

    public void recordClaimCacheHit() {
        registry.counter("ledger.idempotency.cache", "result", "hit").increment();
    }

    public void recordClaimCacheMiss() {
        registry.counter("ledger.idempotency.cache", "result", "miss").increment();
    }

    /**
     * @param phase initiation or settlement
     */
    public void recordPaymentRecorded(String phase, String currency) {
        registry.counter("ledger.payments.recorded",
                "phase", sanitizeTag(phase),
                "currency", sanitizeTag(currency)
        ).increment();
    }

    public void recordSkipped(String eventType, String reason) {
        registry.counter("ledger.events.skipped",
                "event_type", sanitizeTag(eventType),
                "reason", sanitizeTag(reason)
        ).increment();
    }

    /**
     * @param field which attribute disagreed, e.g. receiving_account
     */
    public void recordReconciliationMismatch(String field) {
        registry.counter("ledger.reconciliation.mismatch", "field", sanitizeTag(field)).increment();
    }

    /**
     * @param origin requested (issued here) or external (issued elsewhere)
     */
    public void recordRefund(String origin) {
        registry.counter("ledger.refunds.recorded", "origin", sanitizeTag(origin)).increment();
    }

    public void recordDispute(String outcome) {
        registry.counter("ledger.disputes", "outcome", sanitizeTag(outcome)).increment();
    }

    public void recordFeeLockClaim(boolean shouldCharge, boolean rollover) {
        registry.counter("ledger.fee_lock.claims",
                "should_charge", String.valueOf(shouldCharge),
                "rollover", String.valueOf(rollover)
        ).increment();
    }

    public void recordProcessorCall(String operation, String status, long durationMs) {
        registry.timer("ledger.processor.calls",
                "operation", sanitizeTag(operation),
                "status", sanitizeTag(status)
        ).record(Duration.ofMillis(durationMs));
    }

    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_.]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}

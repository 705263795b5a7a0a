package com.flagship.club_ledger.webhook;

import com.flagship.club_ledger.observability.CorrelationContext;
import com.flagship.club_ledger.observability.LedgerMetrics;
import com.flagship.club_ledger.payment.RecordingOutcome;
import com.flagship.club_ledger.processor.ProcessorEvent;
import com.flagship.club_ledger.processor.ProcessorProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Entry point for processor notifications: verify, claim, route, mark.
 *
 * A delivery is claimed before any handler runs and the claim is marked
 * COMPLETED or FAILED afterwards. Claims are permanent by default, so a
 * redelivery of a FAILED event is answered as a duplicate and the failure has
 * to be resolved by an operator.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WebhookIngestionService {

    private final IdempotencyGate idempotencyGate;
    private final ProcessorEventRouter router;
    private final ProcessorProperties processorProperties;
    private final LedgerMetrics metrics;

    /**
     * @throws com.flagship.club_ledger.processor.InvalidSignatureException if the payload is not authentic
     * @throws WebhookProcessingException if the claim or the handler failed
     */
    public WebhookOutcome ingest(String payload, String signature) {
        ProcessorEvent event = idempotencyGate.verify(payload, signature, processorProperties.getWebhookSecret());

        long startTime = System.currentTimeMillis();
        CorrelationContext.putEvent(event.id(), event.type());
        metrics.recordWebhookReceived(event.type());
        try {
            if (!claim(event)) {
                metrics.recordWebhookOutcome(event.type(), "duplicate");
                return WebhookOutcome.DUPLICATE;
            }

            Optional<RecordingOutcome> outcome;
            try {
                outcome = router.route(event);
            } catch (RuntimeException e) {
                fail(event, e);
                throw new WebhookProcessingException(event.id(),
                        "Processing failed for event " + event.id() + ": " + e.getMessage(), e);
            }

            idempotencyGate.markComplete(event.id());
            if (outcome.isEmpty()) {
                metrics.recordWebhookOutcome(event.type(), "ignored");
                return WebhookOutcome.IGNORED;
            }
            log.info("Event {} ({}) handled: {}", event.id(), event.type(), outcome.get());
            metrics.recordWebhookOutcome(event.type(), "processed");
            return WebhookOutcome.PROCESSED;
        } finally {
            metrics.recordWebhookLatency(event.type(), System.currentTimeMillis() - startTime);
            CorrelationContext.clearEvent();
        }
    }

    private boolean claim(ProcessorEvent event) {
        try {
            return idempotencyGate.claim(event.id(), event.type());
        } catch (DataAccessException e) {
            log.error("Could not claim event {}: {}", event.id(), e.getMessage(), e);
            metrics.recordWebhookOutcome(event.type(), "claim_failed");
            throw new WebhookProcessingException(event.id(), "Could not claim event " + event.id(), e);
        }
    }

    private void fail(ProcessorEvent event, RuntimeException cause) {
        log.error("Event {} ({}) failed: {}", event.id(), event.type(), cause.getMessage(), cause);
        metrics.recordWebhookOutcome(event.type(), "failed");
        try {
            idempotencyGate.markFailed(event.id(), cause.getClass().getSimpleName() + ": " + cause.getMessage());
        } catch (RuntimeException markError) {
            log.error("Could not mark event {} FAILED, claim left PROCESSING", event.id(), markError);
            cause.addSuppressed(markError);
        }
    }
}

package com.flagship.club_ledger.notification;

import com.flagship.club_ledger.config.AsyncConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Queues receipts in the outbox once the ledger change that produced them has
 * committed. Runs on the receipt executor; a failure here is logged and the
 * receipt is lost, the ledger is not affected.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ReceiptDispatchListener {

    private final ReceiptOutboxWriter outboxWriter;

    @Async(AsyncConfig.RECEIPT_EXECUTOR)
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onReceiptRequested(ReceiptRequestedEvent event) {
        try {
            outboxWriter.enqueue(event);
            log.info("Queued {} for transaction {}", event.receiptType(), event.transactionId());
        } catch (RuntimeException e) {
            log.error("Failed to queue {} for transaction {}: {}",
                    event.receiptType(), event.transactionId(), e.getMessage(), e);
        }
    }
}

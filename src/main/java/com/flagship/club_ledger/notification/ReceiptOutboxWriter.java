package com.flagship.club_ledger.notification;

import com.flagship.club_ledger.outbox.OutboxPublisher;
import com.flagship.club_ledger.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Component
@RequiredArgsConstructor
public class ReceiptOutboxWriter {

    private final OutboxService outboxService;

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void enqueue(ReceiptRequestedEvent event) {
        outboxService.saveEvent(OutboxPublisher.RECEIPT_AGGREGATE, event.transactionId(),
                event.receiptType(), event.receipt());
    }
}

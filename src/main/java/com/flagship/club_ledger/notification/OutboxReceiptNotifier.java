package com.flagship.club_ledger.notification;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Hands receipts to {@link ReceiptDispatchListener} as application events.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OutboxReceiptNotifier implements ReceiptNotifier {

    private final ApplicationEventPublisher eventPublisher;

    @Override
    public void notifyReceipt(PaymentReceipt receipt) {
        log.debug("Receipt requested for payment {}", receipt.transactionId());
        eventPublisher.publishEvent(new ReceiptRequestedEvent(
                receipt.transactionId(), ReceiptRequestedEvent.PAYMENT_RECEIPT, receipt));
    }

    @Override
    public void notifyRefundReceipt(RefundReceipt receipt) {
        log.debug("Receipt requested for refund {}", receipt.refundTransactionId());
        eventPublisher.publishEvent(new ReceiptRequestedEvent(
                receipt.refundTransactionId(), ReceiptRequestedEvent.REFUND_RECEIPT, receipt));
    }
}

package com.flagship.club_ledger.notification;

import java.util.UUID;

/**
 * Spring application event carrying a receipt to the dispatch listener.
 */
public record ReceiptRequestedEvent(UUID transactionId, String receiptType, Object receipt) {

    public static final String PAYMENT_RECEIPT = "PaymentReceipt";
    public static final String REFUND_RECEIPT = "RefundReceipt";
}

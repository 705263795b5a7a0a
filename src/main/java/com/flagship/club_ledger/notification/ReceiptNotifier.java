package com.flagship.club_ledger.notification;

/**
 * Outbound receipt channel. Calls return immediately; delivery happens after
 * the caller's transaction commits and its failure never reaches the caller.
 */
public interface ReceiptNotifier {

    void notifyReceipt(PaymentReceipt receipt);

    void notifyRefundReceipt(RefundReceipt receipt);
}

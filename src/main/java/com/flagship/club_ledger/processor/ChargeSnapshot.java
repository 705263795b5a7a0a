package com.flagship.club_ledger.processor;

import java.util.List;
import java.util.Map;

/**
 * Charge object as carried on settlement and refund notifications.
 *
 * {@code estimatedApplicationFee} is whatever the payload said; it is never
 * written to the ledger. Settled figures come from {@link SettlementDetails}.
 * {@code refunds} is null when the payload did not include the refund list.
 */
public record ChargeSnapshot(
        String chargeId,
        String paymentIntentId,
        long amount,
        String currency,
        Long estimatedApplicationFee,
        String applicationFeeId,
        boolean refunded,
        long amountRefunded,
        List<RefundSnapshot> refunds,
        Map<String, String> metadata,
        String paymentMethodType,
        String cardLast4) implements EventPayload {

    public ChargeSnapshot {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
        refunds = refunds == null ? null : List.copyOf(refunds);
    }

    public boolean hasRefundList() {
        return refunds != null;
    }
}

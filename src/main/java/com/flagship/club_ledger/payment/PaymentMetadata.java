package com.flagship.club_ledger.payment;

import com.flagship.club_ledger.payment.purpose.PaymentPurpose;

/**
 * Decoded checkout metadata: who paid whom, for what.
 */
public record PaymentMetadata(
        String organizerRef,
        String payerRef,
        String payerName,
        String payerEmail,
        String referenceId,
        String eventName,
        String accountFeeLockId,
        PaymentPurpose purpose) {

    public boolean hasOrganizer() {
        return organizerRef != null && !organizerRef.isBlank();
    }

    public boolean hasAccountFeeLock() {
        return accountFeeLockId != null && !accountFeeLockId.isBlank();
    }
}

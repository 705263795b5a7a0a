package com.flagship.club_ledger.notification;

import com.flagship.club_ledger.transaction.FinancialTransaction;

import java.time.Instant;
import java.util.UUID;

public record PaymentReceipt(
        UUID transactionId,
        String organizerRef,
        String payerRef,
        String payerName,
        String payerEmail,
        long amount,
        String currency,
        String purposeType,
        String referenceId,
        String referenceName,
        String paymentMethodType,
        String cardLast4,
        Instant paidAt) {

    public static PaymentReceipt from(FinancialTransaction payment) {
        return new PaymentReceipt(
                payment.getId(),
                payment.getOrganizerRef(),
                payment.getPayerRef(),
                payment.getPayerName(),
                payment.getPayerEmail(),
                payment.getAmount(),
                payment.getCurrency(),
                payment.getPurposeType(),
                payment.getReferenceId(),
                payment.getReferenceName(),
                payment.getPaymentMethodType(),
                payment.getCardLast4(),
                payment.getCompletedAt());
    }
}

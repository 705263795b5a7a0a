package com.flagship.club_ledger.payment.purpose;

/**
 * A {@code type} this version does not recognise, or none at all. The payment
 * is still recorded.
 */
public record UnknownPurpose(String rawType) implements PaymentPurpose {

    @Override
    public String typeCode() {
        return rawType == null || rawType.isBlank() ? "unknown" : rawType;
    }
}

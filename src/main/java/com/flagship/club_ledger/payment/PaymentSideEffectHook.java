package com.flagship.club_ledger.payment;

import com.flagship.club_ledger.payment.purpose.PaymentPurpose;

/**
 * Applies the business consequence of a paid checkout: confirm an RSVP, create
 * court bookings, mark a tournament registration paid and so on.
 *
 * Called once per paid checkout, after any provisional ledger row is
 * committed. That includes platform purchases, which have no organizer row,
 * and payments whose settlement was recorded first. A thrown exception fails
 * the notification; the ledger row stays.
 */
public interface PaymentSideEffectHook {

    void applyPaymentSideEffect(PaymentPurpose purpose, PaymentMetadata metadata, long amount);
}

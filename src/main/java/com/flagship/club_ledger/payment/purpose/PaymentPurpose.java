package com.flagship.club_ledger.payment.purpose;

/**
 * Why a payment was made. Decoded once from processor metadata so handlers
 * work with typed fields.
 */
public sealed interface PaymentPurpose
        permits MeetupPurpose, CourtBookingPurpose, TournamentPurpose, LeaguePurpose,
                CreditBundlePurpose, UnknownPurpose {

    /** Value of the {@code type} metadata entry for this purpose. */
    String typeCode();

    /**
     * Purchases that pay the platform itself rather than an organizer. These
     * never get an organizer ledger row or a receipt.
     */
    default boolean isPlatformOnly() {
        return false;
    }
}

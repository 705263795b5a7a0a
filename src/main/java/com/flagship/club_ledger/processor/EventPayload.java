package com.flagship.club_ledger.processor;

/**
 * The object carried by a processor event. One variant per object kind the
 * ledger understands; everything else is {@link Unhandled}.
 */
public sealed interface EventPayload
        permits CheckoutSessionSnapshot, ChargeSnapshot, DisputeSnapshot, EventPayload.Unhandled {

    record Unhandled(String objectType) implements EventPayload {
    }
}

package com.flagship.club_ledger.processor;

import java.time.Instant;
import java.util.Objects;

/**
 * A signature-verified notification from the payment processor, decoded into
 * processor-neutral form.
 *
 * {@code receivingAccountRef} is the sub-account the event was raised on; it is
 * null for events on the platform's own account.
 */
public record ProcessorEvent(
        String id,
        String type,
        String receivingAccountRef,
        boolean livemode,
        Instant createdAt,
        EventPayload payload) {

    public static final String CHECKOUT_COMPLETED = "checkout.session.completed";
    public static final String CHARGE_SUCCEEDED = "charge.succeeded";
    public static final String CHARGE_REFUNDED = "charge.refunded";
    public static final String DISPUTE_CREATED = "charge.dispute.created";
    public static final String DISPUTE_UPDATED = "charge.dispute.updated";
    public static final String DISPUTE_CLOSED = "charge.dispute.closed";
    public static final String PAYMENT_INTENT_SUCCEEDED = "payment_intent.succeeded";
    public static final String PAYMENT_INTENT_FAILED = "payment_intent.payment_failed";

    public ProcessorEvent {
        Objects.requireNonNull(id, "event id");
        Objects.requireNonNull(type, "event type");
        if (payload == null) {
            payload = new EventPayload.Unhandled(type);
        }
    }

    public boolean targetsReceivingAccount() {
        return receivingAccountRef != null && !receivingAccountRef.isBlank();
    }
}

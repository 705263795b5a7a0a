package com.flagship.club_ledger.processor.stripe;

import com.flagship.club_ledger.processor.ChargeSnapshot;
import com.flagship.club_ledger.processor.CheckoutSessionSnapshot;
import com.flagship.club_ledger.processor.DisputeSnapshot;
import com.flagship.club_ledger.processor.EventPayload;
import com.flagship.club_ledger.processor.ProcessorEvent;
import com.flagship.club_ledger.processor.RefundSnapshot;
import com.stripe.exception.EventDataObjectDeserializationException;
import com.stripe.model.Charge;
import com.stripe.model.Dispute;
import com.stripe.model.Event;
import com.stripe.model.EventDataObjectDeserializer;
import com.stripe.model.Refund;
import com.stripe.model.StripeObject;
import com.stripe.model.checkout.Session;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.List;

/**
 * Maps Stripe SDK objects onto the processor-neutral snapshots.
 */
@Slf4j
final class StripeEventTranslator {

    private StripeEventTranslator() {
    }

    static ProcessorEvent toProcessorEvent(Event event) {
        Instant created = event.getCreated() != null ? Instant.ofEpochSecond(event.getCreated()) : null;
        return new ProcessorEvent(
                event.getId(),
                event.getType(),
                event.getAccount(),
                Boolean.TRUE.equals(event.getLivemode()),
                created,
                toPayload(event));
    }

    private static EventPayload toPayload(Event event) {
        StripeObject object = deserialize(event);
        if (object instanceof Session session) {
            return toCheckoutSnapshot(session);
        }
        if (object instanceof Charge charge) {
            return toChargeSnapshot(charge);
        }
        if (object instanceof Dispute dispute) {
            return toDisputeSnapshot(dispute);
        }
        return new EventPayload.Unhandled(object != null ? object.getClass().getSimpleName() : event.getType());
    }

    private static StripeObject deserialize(Event event) {
        EventDataObjectDeserializer deserializer = event.getDataObjectDeserializer();
        if (deserializer.getObject().isPresent()) {
            return deserializer.getObject().get();
        }
        // API version of the event differs from the SDK's pinned version
        try {
            log.debug("Event {} API version differs from SDK, deserializing unsafely", event.getId());
            return deserializer.deserializeUnsafe();
        } catch (EventDataObjectDeserializationException e) {
            log.warn("Could not deserialize data object for event {} ({}): {}",
                    event.getId(), event.getType(), e.getMessage());
            return null;
        }
    }

    static CheckoutSessionSnapshot toCheckoutSnapshot(Session session) {
        return new CheckoutSessionSnapshot(
                session.getId(),
                session.getPaymentIntent(),
                session.getPaymentStatus(),
                session.getAmountTotal() != null ? session.getAmountTotal() : 0L,
                session.getCurrency(),
                session.getMetadata());
    }

    static ChargeSnapshot toChargeSnapshot(Charge charge) {
        List<RefundSnapshot> refunds = null;
        if (charge.getRefunds() != null && charge.getRefunds().getData() != null) {
            refunds = charge.getRefunds().getData().stream()
                    .map(StripeEventTranslator::toRefundSnapshot)
                    .toList();
        }
        String methodType = null;
        String last4 = null;
        if (charge.getPaymentMethodDetails() != null) {
            methodType = charge.getPaymentMethodDetails().getType();
            if (charge.getPaymentMethodDetails().getCard() != null) {
                last4 = charge.getPaymentMethodDetails().getCard().getLast4();
            }
        }
        return new ChargeSnapshot(
                charge.getId(),
                charge.getPaymentIntent(),
                charge.getAmount() != null ? charge.getAmount() : 0L,
                charge.getCurrency(),
                charge.getApplicationFeeAmount(),
                charge.getApplicationFee(),
                Boolean.TRUE.equals(charge.getRefunded()),
                charge.getAmountRefunded() != null ? charge.getAmountRefunded() : 0L,
                refunds,
                charge.getMetadata(),
                methodType,
                last4);
    }

    static DisputeSnapshot toDisputeSnapshot(Dispute dispute) {
        Instant dueBy = null;
        if (dispute.getEvidenceDetails() != null && dispute.getEvidenceDetails().getDueBy() != null) {
            dueBy = Instant.ofEpochSecond(dispute.getEvidenceDetails().getDueBy());
        }
        return new DisputeSnapshot(
                dispute.getId(),
                dispute.getCharge(),
                dispute.getAmount() != null ? dispute.getAmount() : 0L,
                dispute.getStatus(),
                dispute.getReason(),
                dueBy);
    }

    static RefundSnapshot toRefundSnapshot(Refund refund) {
        return new RefundSnapshot(refund.getId(),
                refund.getAmount() != null ? refund.getAmount() : 0L,
                refund.getStatus());
    }
}

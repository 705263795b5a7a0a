package com.flagship.club_ledger.webhook;

import com.flagship.club_ledger.dispute.DisputeTracker;
import com.flagship.club_ledger.payment.RecordingOutcome;
import com.flagship.club_ledger.payment.TwoPhaseRecorder;
import com.flagship.club_ledger.processor.ChargeSnapshot;
import com.flagship.club_ledger.processor.CheckoutSessionSnapshot;
import com.flagship.club_ledger.processor.DisputeSnapshot;
import com.flagship.club_ledger.processor.EventPayload;
import com.flagship.club_ledger.processor.ProcessorEvent;
import com.flagship.club_ledger.refund.RefundTracker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Hands a claimed event to the component that owns its type.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ProcessorEventRouter {

    private final TwoPhaseRecorder twoPhaseRecorder;
    private final RefundTracker refundTracker;
    private final DisputeTracker disputeTracker;

    /**
     * @return empty when the ledger does not act on this event type
     */
    public Optional<RecordingOutcome> route(ProcessorEvent event) {
        EventPayload payload = event.payload();
        return switch (event.type()) {
            case ProcessorEvent.CHECKOUT_COMPLETED ->
                    Optional.of(twoPhaseRecorder.onInitiationNotified(expect(event, payload, CheckoutSessionSnapshot.class), event));
            case ProcessorEvent.CHARGE_SUCCEEDED ->
                    Optional.of(twoPhaseRecorder.onSettlementNotified(expect(event, payload, ChargeSnapshot.class), event));
            case ProcessorEvent.CHARGE_REFUNDED ->
                    Optional.of(refundTracker.onRefundNotified(expect(event, payload, ChargeSnapshot.class), event));
            case ProcessorEvent.DISPUTE_CREATED ->
                    Optional.of(disputeTracker.onDisputeOpened(expect(event, payload, DisputeSnapshot.class), event));
            case ProcessorEvent.DISPUTE_UPDATED ->
                    Optional.of(disputeTracker.onDisputeUpdated(expect(event, payload, DisputeSnapshot.class), event));
            case ProcessorEvent.DISPUTE_CLOSED ->
                    Optional.of(disputeTracker.onDisputeClosed(expect(event, payload, DisputeSnapshot.class), event));
            case ProcessorEvent.PAYMENT_INTENT_SUCCEEDED, ProcessorEvent.PAYMENT_INTENT_FAILED -> {
                // Recorded through the checkout and charge events
                log.info("Payment intent event {} acknowledged", event.type());
                yield Optional.empty();
            }
            default -> {
                log.debug("Unhandled event type {}, acknowledging", event.type());
                yield Optional.empty();
            }
        };
    }

    private static <T extends EventPayload> T expect(ProcessorEvent event, EventPayload payload, Class<T> type) {
        if (!type.isInstance(payload)) {
            throw new IllegalArgumentException(String.format(
                    "Event %s of type %s carries %s, expected %s",
                    event.id(), event.type(), payload.getClass().getSimpleName(), type.getSimpleName()));
        }
        return type.cast(payload);
    }
}

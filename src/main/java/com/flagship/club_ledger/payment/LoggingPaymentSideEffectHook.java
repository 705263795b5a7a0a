package com.flagship.club_ledger.payment;

import com.flagship.club_ledger.payment.purpose.CourtBookingPurpose;
import com.flagship.club_ledger.payment.purpose.CourtSlot;
import com.flagship.club_ledger.payment.purpose.CreditBundlePurpose;
import com.flagship.club_ledger.payment.purpose.LeaguePurpose;
import com.flagship.club_ledger.payment.purpose.MeetupPurpose;
import com.flagship.club_ledger.payment.purpose.PaymentPurpose;
import com.flagship.club_ledger.payment.purpose.TournamentPurpose;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Default hook for deployments where event and roster management lives in
 * another service: logs what that service should do.
 */
@Component
@Slf4j
public class LoggingPaymentSideEffectHook implements PaymentSideEffectHook {

    @Override
    public void applyPaymentSideEffect(PaymentPurpose purpose, PaymentMetadata metadata, long amount) {
        if (purpose instanceof MeetupPurpose meetup) {
            log.info("Meetup {}: mark attendee {} paid ({})", meetup.meetupId(), metadata.payerRef(), amount);
        } else if (purpose instanceof CourtBookingPurpose booking) {
            for (CourtSlot slot : booking.slots()) {
                log.info("Court booking for {}: court {} on {} {}-{}",
                        metadata.payerRef(), slot.courtId(), slot.date(), slot.startTime(), slot.endTime());
            }
            if (booking.slots().isEmpty()) {
                log.warn("Court booking payment from {} carried no slots", metadata.payerRef());
            }
        } else if (purpose instanceof TournamentPurpose tournament) {
            log.info("Tournament {}: registration {} paid for divisions {}",
                    tournament.tournamentId(), tournament.registrationId(), tournament.divisionIds());
        } else if (purpose instanceof LeaguePurpose league) {
            log.info("League {}: member {} paid ({})", league.leagueId(), metadata.payerRef(), amount);
        } else if (purpose instanceof CreditBundlePurpose bundle) {
            log.info("Credit bundle {}: add {} messaging credits to organizer {}",
                    bundle.bundleId(), bundle.credits(), metadata.organizerRef());
        } else {
            log.info("No side effect for payment purpose '{}'", purpose.typeCode());
        }
    }
}

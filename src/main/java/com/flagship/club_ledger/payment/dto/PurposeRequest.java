package com.flagship.club_ledger.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.club_ledger.payment.purpose.CourtBookingPurpose;
import com.flagship.club_ledger.payment.purpose.CourtSlot;
import com.flagship.club_ledger.payment.purpose.CreditBundlePurpose;
import com.flagship.club_ledger.payment.purpose.LeaguePurpose;
import com.flagship.club_ledger.payment.purpose.MeetupPurpose;
import com.flagship.club_ledger.payment.purpose.PaymentPurpose;
import com.flagship.club_ledger.payment.purpose.TournamentPurpose;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * What the checkout is for. Only the fields of the named {@code type} are read.
 */
@Value
public class PurposeRequest {

    @NotBlank(message = "Purpose type is required")
    @JsonProperty("type")
    String type;

    @JsonProperty("meetup_id")
    String meetupId;

    @JsonProperty("slots")
    List<CourtSlot> slots;

    @JsonProperty("tournament_id")
    String tournamentId;

    @JsonProperty("registration_id")
    String registrationId;

    @JsonProperty("division_ids")
    List<String> divisionIds;

    @JsonProperty("partner_details")
    Map<String, Object> partnerDetails;

    @JsonProperty("league_id")
    String leagueId;

    @JsonProperty("bundle_id")
    String bundleId;

    @JsonProperty("bundle_name")
    String bundleName;

    @JsonProperty("credits")
    Integer credits;

    /**
     * @throws IllegalArgumentException for a type the ledger does not know
     */
    public PaymentPurpose toPurpose() {
        return switch (type) {
            case MeetupPurpose.TYPE -> new MeetupPurpose(meetupId);
            case CourtBookingPurpose.TYPE -> new CourtBookingPurpose(slots);
            case TournamentPurpose.TYPE -> new TournamentPurpose(tournamentId, registrationId, divisionIds, partnerDetails);
            case LeaguePurpose.TYPE -> new LeaguePurpose(leagueId);
            case CreditBundlePurpose.TYPE -> new CreditBundlePurpose(bundleId, bundleName, credits == null ? 0 : credits);
            default -> throw new IllegalArgumentException("Unknown purpose type: " + type);
        };
    }
}

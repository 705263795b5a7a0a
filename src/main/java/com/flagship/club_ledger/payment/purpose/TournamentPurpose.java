package com.flagship.club_ledger.payment.purpose;

import java.util.List;
import java.util.Map;

/**
 * Tournament entry fee. {@code partnerDetails} is passed through to the
 * registration handler untouched.
 */
public record TournamentPurpose(String tournamentId,
                                String registrationId,
                                List<String> divisionIds,
                                Map<String, Object> partnerDetails) implements PaymentPurpose {

    public static final String TYPE = "tournament";

    public TournamentPurpose {
        divisionIds = divisionIds == null ? List.of() : List.copyOf(divisionIds);
        partnerDetails = partnerDetails == null ? Map.of() : Map.copyOf(partnerDetails);
    }

    @Override
    public String typeCode() {
        return TYPE;
    }
}

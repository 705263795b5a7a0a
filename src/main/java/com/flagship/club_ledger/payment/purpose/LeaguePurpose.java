package com.flagship.club_ledger.payment.purpose;

public record LeaguePurpose(String leagueId) implements PaymentPurpose {

    public static final String TYPE = "league";

    @Override
    public String typeCode() {
        return TYPE;
    }
}

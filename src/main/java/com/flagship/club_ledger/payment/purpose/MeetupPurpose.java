package com.flagship.club_ledger.payment.purpose;

public record MeetupPurpose(String meetupId) implements PaymentPurpose {

    public static final String TYPE = "meetup";

    @Override
    public String typeCode() {
        return TYPE;
    }
}

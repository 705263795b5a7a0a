package com.flagship.club_ledger.payment.purpose;

import java.util.List;

public record CourtBookingPurpose(List<CourtSlot> slots) implements PaymentPurpose {

    public static final String TYPE = "court_booking";

    public CourtBookingPurpose {
        slots = slots == null ? List.of() : List.copyOf(slots);
    }

    @Override
    public String typeCode() {
        return TYPE;
    }
}

package com.flagship.club_ledger.payment.purpose;

/**
 * One booked court slot. Dates and times are kept as the club entered them.
 */
public record CourtSlot(String courtId, String date, String startTime, String endTime) {
}

package com.flagship.club_ledger.payment;

/**
 * What a notification handler did with an event.
 */
public enum RecordingOutcome {
    RECORDED,
    /** The ledger already reflected this event. */
    ALREADY_RECORDED,
    /** The event is out of scope for the ledger (guard not met). */
    SKIPPED
}

package com.flagship.club_ledger.webhook;

/**
 * How a verified delivery was handled. All three are acknowledged with 200.
 */
public enum WebhookOutcome {
    /** Claimed and routed to a handler. */
    PROCESSED,
    /** Already claimed by an earlier delivery. */
    DUPLICATE,
    /** Claimed, but the event type is not one the ledger handles. */
    IGNORED
}

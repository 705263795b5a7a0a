package com.flagship.club_ledger.dispute;

/**
 * A dispute notification contradicts the outcome already recorded for it.
 */
public class InvalidDisputeStateException extends RuntimeException {

    public InvalidDisputeStateException(String message) {
        super(message);
    }
}

package com.flagship.club_ledger.refund;

/**
 * A refund request failed validation. Nothing was sent to the processor and
 * the ledger is unchanged.
 */
public class InvalidRefundRequestException extends RuntimeException {

    public InvalidRefundRequestException(String message) {
        super(message);
    }
}

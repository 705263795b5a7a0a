package com.flagship.club_ledger.processor;

/**
 * Webhook signature did not verify. The event is never claimed and the
 * processor receives a non-retryable rejection.
 */
public class InvalidSignatureException extends RuntimeException {

    public InvalidSignatureException(String message) {
        super(message);
    }

    public InvalidSignatureException(String message, Throwable cause) {
        super(message, cause);
    }
}

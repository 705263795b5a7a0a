package com.flagship.club_ledger.processor;

/**
 * A call to the payment processor failed or returned unusable data.
 */
public class ProcessorException extends RuntimeException {

    public ProcessorException(String message) {
        super(message);
    }

    public ProcessorException(String message, Throwable cause) {
        super(message, cause);
    }
}

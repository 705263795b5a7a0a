package com.flagship.club_ledger.webhook;

import lombok.Getter;

/**
 * Handling a claimed event failed, or the claim itself could not be taken.
 * Answered with 500 so the processor redelivers.
 */
@Getter
public class WebhookProcessingException extends RuntimeException {

    private final String eventId;

    public WebhookProcessingException(String eventId, String message, Throwable cause) {
        super(message, cause);
        this.eventId = eventId;
    }
}

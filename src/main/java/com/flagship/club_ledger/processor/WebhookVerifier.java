package com.flagship.club_ledger.processor;

/**
 * Checks a webhook signature and decodes the payload.
 */
public interface WebhookVerifier {

    /**
     * @throws InvalidSignatureException if the signature does not match the payload and secret
     */
    ProcessorEvent verify(String payload, String signature, String sharedSecret);
}

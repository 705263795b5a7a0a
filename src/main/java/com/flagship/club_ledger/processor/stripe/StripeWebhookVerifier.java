package com.flagship.club_ledger.processor.stripe;

import com.flagship.club_ledger.processor.InvalidSignatureException;
import com.flagship.club_ledger.processor.ProcessorEvent;
import com.flagship.club_ledger.processor.ProcessorProperties;
import com.flagship.club_ledger.processor.WebhookVerifier;
import com.google.gson.JsonSyntaxException;
import com.stripe.exception.SignatureVerificationException;
import com.stripe.model.Event;
import com.stripe.net.Webhook;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Verifies the {@code Stripe-Signature} header and translates the event.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StripeWebhookVerifier implements WebhookVerifier {

    private final ProcessorProperties properties;

    @Override
    public ProcessorEvent verify(String payload, String signature, String sharedSecret) {
        if (!StringUtils.hasText(sharedSecret)) {
            log.warn("Webhook secret not configured; rejecting request");
            throw new InvalidSignatureException("Webhook secret not configured");
        }
        if (!StringUtils.hasText(signature)) {
            throw new InvalidSignatureException("Missing signature header");
        }

        Event event;
        try {
            event = Webhook.constructEvent(payload, signature, sharedSecret,
                    properties.getSignatureToleranceSeconds());
        } catch (SignatureVerificationException e) {
            log.warn("Webhook signature verification failed: {}", e.getMessage());
            throw new InvalidSignatureException("Invalid signature", e);
        } catch (JsonSyntaxException e) {
            throw new InvalidSignatureException("Malformed event payload", e);
        }
        return StripeEventTranslator.toProcessorEvent(event);
    }
}

package com.flagship.club_ledger.webhook;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Locale;
import java.util.Map;

/**
 * Receives signed notifications from the payment processor.
 *
 * The body is taken as the raw string because the signature is computed over
 * the exact bytes sent. A missing signature header is a verification failure
 * (400), not a malformed request.
 */
@RestController
@RequestMapping("/api/webhooks")
@RequiredArgsConstructor
@Slf4j
public class ProcessorWebhookController {

    static final String SIGNATURE_HEADER = "Stripe-Signature";

    private final WebhookIngestionService ingestionService;

    @PostMapping("/processor")
    public ResponseEntity<Map<String, Object>> receive(
            @RequestHeader(value = SIGNATURE_HEADER, required = false) String signature,
            @RequestBody String payload) {
        WebhookOutcome outcome = ingestionService.ingest(payload, signature);
        return ResponseEntity.ok(Map.of(
                "received", true,
                "outcome", outcome.name().toLowerCase(Locale.ROOT)));
    }
}

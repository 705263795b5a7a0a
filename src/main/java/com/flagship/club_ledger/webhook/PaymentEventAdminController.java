package com.flagship.club_ledger.webhook;

import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Operator view of event claims. FAILED and stuck claims need manual
 * reconciliation because redeliveries are treated as duplicates.
 */
@RestController
@RequestMapping("/api/admin/payment-events")
@RequiredArgsConstructor
public class PaymentEventAdminController {

    private final IdempotencyGate idempotencyGate;

    @GetMapping
    public List<PaymentEventRecord> recent(@RequestParam(value = "status", required = false) PaymentEventStatus status) {
        return idempotencyGate.findRecent(status);
    }

    @GetMapping("/stuck")
    public List<PaymentEventRecord> stuck() {
        return idempotencyGate.findStuck();
    }

    @GetMapping("/{id}")
    public ResponseEntity<PaymentEventRecord> get(@PathVariable("id") String eventId) {
        return idempotencyGate.find(eventId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }
}

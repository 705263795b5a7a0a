package com.flagship.club_ledger.reconciliation;

import com.flagship.club_ledger.reconciliation.dto.AddMissingPaymentRequest;
import com.flagship.club_ledger.transaction.FinancialTransaction;
import com.flagship.club_ledger.transaction.dto.TransactionResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;

/**
 * Operator reconciliation of one receiving account against the processor.
 * Window bounds are ISO-8601 instants.
 */
@RestController
@RequestMapping("/api/admin/reconciliation")
@RequiredArgsConstructor
@Slf4j
public class ReconciliationController {

    private final ReconciliationService reconciliationService;

    @GetMapping("/charges")
    public ReconciliationReport charges(
            @RequestParam("account") String receivingAccountRef,
            @RequestParam("from") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam("to") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to) {
        return reconciliationService.reconcileCharges(receivingAccountRef, from, to);
    }

    @GetMapping("/settlements")
    public ReconciliationReport settlements(
            @RequestParam("account") String receivingAccountRef,
            @RequestParam("from") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam("to") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to) {
        return reconciliationService.reconcileSettlements(receivingAccountRef, from, to);
    }

    @PostMapping("/missing-payments")
    public ResponseEntity<TransactionResponse> addMissingPayment(@Valid @RequestBody AddMissingPaymentRequest request) {
        log.info("Missing payment requested for charge {} on {} by {}",
                request.getChargeId(), request.getReceivingAccountRef(), request.getRequestedBy());
        FinancialTransaction payment = reconciliationService.addMissingPayment(
                request.getReceivingAccountRef(), request.getChargeId(), request.getRequestedBy());
        return ResponseEntity.status(HttpStatus.CREATED).body(TransactionResponse.from(payment));
    }
}

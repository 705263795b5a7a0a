package com.flagship.club_ledger.transaction;

import com.flagship.club_ledger.transaction.dto.TransactionResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Read-only view of ledger rows.
 */
@RestController
@RequestMapping("/api/transactions")
@RequiredArgsConstructor
public class TransactionController {

    private final TransactionLedgerStore ledgerStore;

    @GetMapping("/{id}")
    public ResponseEntity<TransactionResponse> getTransaction(@PathVariable("id") UUID id) {
        return ledgerStore.findById(id)
                .map(tx -> ResponseEntity.ok(TransactionResponse.from(tx)))
                .orElse(ResponseEntity.notFound().build());
    }

    /**
     * The payment for a payment intent followed by its refunds and disputes.
     */
    @GetMapping
    public List<TransactionResponse> findByPaymentIntent(@RequestParam("paymentIntentId") String paymentIntentId) {
        return ledgerStore.findPaymentByPaymentIntent(paymentIntentId)
                .map(payment -> {
                    List<FinancialTransaction> rows = new ArrayList<>();
                    rows.add(payment);
                    rows.addAll(ledgerStore.findChildren(payment.getId()));
                    return rows.stream().map(TransactionResponse::from).toList();
                })
                .orElse(List.of());
    }
}

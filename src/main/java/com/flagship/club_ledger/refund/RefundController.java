package com.flagship.club_ledger.refund;

import com.flagship.club_ledger.refund.dto.RefundRequest;
import com.flagship.club_ledger.refund.dto.RefundResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * Operator-initiated refunds. The refund stays PROCESSING until the
 * processor's refund notification confirms it.
 */
@RestController
@RequestMapping("/api/transactions/{id}/refunds")
@RequiredArgsConstructor
@Slf4j
public class RefundController {

    private final RefundTracker refundTracker;

    @PostMapping
    public ResponseEntity<RefundResponse> createRefund(@PathVariable("id") UUID transactionId,
                                                       @Valid @RequestBody RefundRequest request) {
        log.info("Refund requested for transaction {}: amount={}, by={}",
                transactionId, request.getAmount(), request.getInitiatedBy());
        RefundResult result = refundTracker.createRefund(
                transactionId, request.getAmount(), request.getReason(), request.getInitiatedBy());
        return ResponseEntity.status(HttpStatus.CREATED).body(RefundResponse.from(result));
    }
}

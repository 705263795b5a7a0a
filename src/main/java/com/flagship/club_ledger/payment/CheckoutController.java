package com.flagship.club_ledger.payment;

import com.flagship.club_ledger.payment.dto.CheckoutRequest;
import com.flagship.club_ledger.payment.dto.CheckoutResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/checkout")
@RequiredArgsConstructor
@Slf4j
public class CheckoutController {

    private final CheckoutService checkoutService;

    @PostMapping
    public ResponseEntity<CheckoutResponse> createCheckout(@Valid @RequestBody CheckoutRequest request) {
        log.info("Checkout requested: payer={}, amount={} {}, purpose={}",
                request.getPayerRef(), request.getAmount(), request.getCurrency(), request.getPurpose().getType());
        return ResponseEntity.status(HttpStatus.CREATED).body(checkoutService.createCheckout(request));
    }
}

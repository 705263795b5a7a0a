package com.flagship.club_ledger.refund.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.club_ledger.refund.RefundResult;
import com.flagship.club_ledger.transaction.TransactionStatus;
import lombok.Builder;
import lombok.Value;

import java.util.UUID;

@Value
@Builder
public class RefundResponse {

    @JsonProperty("refund_id")
    String refundId;

    @JsonProperty("refund_transaction_id")
    UUID refundTransactionId;

    @JsonProperty("payment_transaction_id")
    UUID paymentTransactionId;

    @JsonProperty("amount")
    long amount;

    @JsonProperty("status")
    TransactionStatus status;

    public static RefundResponse from(RefundResult result) {
        return RefundResponse.builder()
                .refundId(result.refundId())
                .refundTransactionId(result.refundTransactionId())
                .paymentTransactionId(result.paymentTransactionId())
                .amount(result.amount())
                .status(result.status())
                .build();
    }
}

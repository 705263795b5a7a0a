package com.flagship.club_ledger.transaction.dto;

import com.flagship.club_ledger.transaction.FinancialTransaction;
import com.flagship.club_ledger.transaction.TransactionKind;
import com.flagship.club_ledger.transaction.TransactionStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class TransactionResponse {
    UUID id;
    TransactionKind kind;
    TransactionStatus status;
    long amount;
    String currency;
    String organizerRef;
    String receivingAccountRef;
    String payerName;
    String purposeType;
    String referenceId;
    String referenceName;
    String paymentIntentId;
    String chargeId;
    String refundId;
    String disputeId;
    UUID parentTransactionId;
    long platformFee;
    long totalFee;
    long netAmount;
    String disputeReason;
    Instant disputeDueBy;
    Instant createdAt;
    Instant updatedAt;
    Instant completedAt;

    public static TransactionResponse from(FinancialTransaction tx) {
        return TransactionResponse.builder()
                .id(tx.getId())
                .kind(tx.getKind())
                .status(tx.getStatus())
                .amount(tx.getAmount())
                .currency(tx.getCurrency())
                .organizerRef(tx.getOrganizerRef())
                .receivingAccountRef(tx.getReceivingAccountRef())
                .payerName(tx.getPayerName())
                .purposeType(tx.getPurposeType())
                .referenceId(tx.getReferenceId())
                .referenceName(tx.getReferenceName())
                .paymentIntentId(tx.getPaymentIntentId())
                .chargeId(tx.getChargeId())
                .refundId(tx.getRefundId())
                .disputeId(tx.getDisputeId())
                .parentTransactionId(tx.getParentTransactionId())
                .platformFee(tx.getPlatformFee())
                .totalFee(tx.getTotalFee())
                .netAmount(tx.getNetAmount())
                .disputeReason(tx.getDisputeReason())
                .disputeDueBy(tx.getDisputeDueBy())
                .createdAt(tx.getCreatedAt())
                .updatedAt(tx.getUpdatedAt())
                .completedAt(tx.getCompletedAt())
                .build();
    }
}

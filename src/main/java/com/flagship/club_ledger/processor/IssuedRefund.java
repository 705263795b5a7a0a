package com.flagship.club_ledger.processor;

public record IssuedRefund(String refundId, long amount, String status) {
}

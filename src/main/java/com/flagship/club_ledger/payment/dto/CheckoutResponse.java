package com.flagship.club_ledger.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class CheckoutResponse {

    @JsonProperty("session_id")
    String sessionId;

    @JsonProperty("url")
    String url;

    @JsonProperty("amount")
    long amount;

    @JsonProperty("application_fee")
    long applicationFee;

    @JsonProperty("account_fee_charged")
    boolean accountFeeCharged;
}

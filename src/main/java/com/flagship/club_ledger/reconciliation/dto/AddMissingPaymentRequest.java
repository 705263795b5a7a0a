package com.flagship.club_ledger.reconciliation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

@Value
public class AddMissingPaymentRequest {

    @NotBlank(message = "Receiving account is required")
    @JsonProperty("receiving_account_ref")
    String receivingAccountRef;

    @NotBlank(message = "Charge id is required")
    @JsonProperty("charge_id")
    String chargeId;

    @NotBlank(message = "Requested by is required")
    @JsonProperty("requested_by")
    String requestedBy;
}

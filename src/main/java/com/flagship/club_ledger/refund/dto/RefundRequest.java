package com.flagship.club_ledger.refund.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.Value;

/**
 * Operator refund request. Omit {@code amount} to refund the full gross.
 */
@Value
public class RefundRequest {

    @Positive(message = "Amount must be greater than 0")
    @JsonProperty("amount")
    Long amount;

    @Size(max = 500, message = "Reason must be at most 500 characters")
    @JsonProperty("reason")
    String reason;

    @NotBlank(message = "Initiated by is required")
    @JsonProperty("initiated_by")
    String initiatedBy;
}

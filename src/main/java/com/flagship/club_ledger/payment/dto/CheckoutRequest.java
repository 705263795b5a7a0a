package com.flagship.club_ledger.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import lombok.Value;

/**
 * Request to open a hosted checkout. Amounts are minor units.
 */
@Value
public class CheckoutRequest {

    @JsonProperty("receiving_account_ref")
    String receivingAccountRef;

    @JsonProperty("organizer_id")
    String organizerRef;

    @NotBlank(message = "Payer ID is required")
    @JsonProperty("payer_id")
    String payerRef;

    @JsonProperty("payer_name")
    String payerName;

    @Email(message = "Payer email must be a valid address")
    @JsonProperty("payer_email")
    String payerEmail;

    @JsonProperty("reference_id")
    String referenceId;

    @NotBlank(message = "Item name is required")
    @JsonProperty("item_name")
    String itemName;

    @JsonProperty("item_description")
    String itemDescription;

    @NotNull(message = "Amount is required")
    @Positive(message = "Amount must be greater than 0")
    @JsonProperty("amount")
    Long amount;

    @NotBlank(message = "Currency is required")
    @Pattern(regexp = "^[A-Za-z]{3}$", message = "Currency must be a 3-letter ISO code")
    @JsonProperty("currency")
    String currency;

    @NotBlank(message = "Success URL is required")
    @JsonProperty("success_url")
    String successUrl;

    @NotBlank(message = "Cancel URL is required")
    @JsonProperty("cancel_url")
    String cancelUrl;

    @NotNull(message = "Purpose is required")
    @Valid
    @JsonProperty("purpose")
    PurposeRequest purpose;
}

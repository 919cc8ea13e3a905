package com.flagship.account_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.util.UUID;

@Value
public class TransferRequest {

    @NotNull(message = "From identity ID is required")
    @JsonProperty("from_identity_id")
    UUID fromIdentityId;

    @NotNull(message = "To identity ID is required")
    @JsonProperty("to_identity_id")
    UUID toIdentityId;

    @NotNull(message = "Amount is required")
    @JsonProperty("amount")
    Long amount;
}

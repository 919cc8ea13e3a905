package com.flagship.account_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

/**
 * Deposit or withdrawal body. Amount is in minor units (cents); positivity is checked by
 * the movement service.
 */
@Value
public class AmountRequest {

    @NotNull(message = "Amount is required")
    @JsonProperty("amount")
    Long amount;
}

package com.flagship.account_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.UUID;

@Value
public class BalanceResponse {

    @JsonProperty("identity_id")
    UUID identityId;

    @JsonProperty("balance")
    long balance;
}

package com.flagship.account_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.account_ledger.identity.Identity;
import com.flagship.account_ledger.ledger.LedgerIds;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Ledger account ids are rendered as unsigned decimal strings; they do not fit a JSON number
 * safely.
 */
@Value
@Builder
public class IdentityResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("email")
    String email;

    @JsonProperty("full_name")
    String fullName;

    @JsonProperty("ledger_account_id")
    String ledgerAccountId;

    @JsonProperty("created_at")
    Instant createdAt;

    public static IdentityResponse from(Identity identity) {
        return IdentityResponse.builder()
            .id(identity.getId())
            .email(identity.getEmail())
            .fullName(identity.getFullName())
            .ledgerAccountId(identity.ledgerAccount().map(LedgerIds::format).orElse(null))
            .createdAt(identity.getCreatedAt())
            .build();
    }
}

package com.flagship.account_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.account_ledger.identity.Identity;
import com.flagship.account_ledger.ledger.LedgerIds;
import com.flagship.account_ledger.movement.IdentityBalance;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Identity with its balance. {@code balance_available} is false when the ledger could not be
 * read and the balance shown is the 0 fallback.
 */
@Value
@Builder
public class IdentitySummaryResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("email")
    String email;

    @JsonProperty("full_name")
    String fullName;

    @JsonProperty("ledger_account_id")
    String ledgerAccountId;

    @JsonProperty("balance")
    long balance;

    @JsonProperty("balance_available")
    boolean balanceAvailable;

    @JsonProperty("created_at")
    Instant createdAt;

    public static IdentitySummaryResponse from(IdentityBalance summary) {
        Identity identity = summary.getIdentity();
        return IdentitySummaryResponse.builder()
            .id(identity.getId())
            .email(identity.getEmail())
            .fullName(identity.getFullName())
            .ledgerAccountId(identity.ledgerAccount().map(LedgerIds::format).orElse(null))
            .balance(summary.getBalance())
            .balanceAvailable(!summary.isDegraded())
            .createdAt(identity.getCreatedAt())
            .build();
    }
}

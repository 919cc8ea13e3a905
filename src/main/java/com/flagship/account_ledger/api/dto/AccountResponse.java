package com.flagship.account_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.account_ledger.ledger.LedgerIds;
import com.flagship.account_ledger.movement.IdentityBalance;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.UUID;

@Value
@Builder
public class AccountResponse {

    @JsonProperty("account_id")
    String accountId;

    @JsonProperty("identity_id")
    UUID identityId;

    @JsonProperty("balance")
    long balance;

    @JsonProperty("balance_available")
    boolean balanceAvailable;

    /**
     * An identity holds at most one ledger account; unlinked identities list none.
     */
    public static List<AccountResponse> listOf(IdentityBalance summary) {
        return summary.getIdentity().ledgerAccount()
            .map(accountId -> List.of(AccountResponse.builder()
                .accountId(LedgerIds.format(accountId))
                .identityId(summary.getIdentity().getId())
                .balance(summary.getBalance())
                .balanceAvailable(!summary.isDegraded())
                .build()))
            .orElse(List.of());
    }
}

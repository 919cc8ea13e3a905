package com.flagship.account_ledger.identity;

import lombok.Value;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * A user known to the identity directory.
 *
 * {@code ledgerAccountId} is null until the identity is provisioned. Once set it never changes.
 */
@Value
public class Identity {
    UUID id;
    String email;
    String fullName;
    Long ledgerAccountId;
    Instant createdAt;
    Instant updatedAt;

    public boolean isLinked() {
        return ledgerAccountId != null;
    }

    public Optional<Long> ledgerAccount() {
        return Optional.ofNullable(ledgerAccountId);
    }

    public Identity linkedTo(long accountId) {
        if (ledgerAccountId != null && ledgerAccountId != accountId) {
            throw new IllegalStateException("Identity " + id + " is already linked to another account");
        }
        return new Identity(id, email, fullName, accountId, createdAt, updatedAt);
    }
}

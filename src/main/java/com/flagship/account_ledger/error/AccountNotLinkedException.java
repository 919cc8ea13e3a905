package com.flagship.account_ledger.error;

import java.util.Map;
import java.util.UUID;

public class AccountNotLinkedException extends BankingException {

    private final UUID identityId;

    public AccountNotLinkedException(UUID identityId) {
        super(ErrorKind.ACCOUNT_NOT_LINKED, "Identity " + identityId + " has no ledger account");
        this.identityId = identityId;
    }

    public UUID getIdentityId() {
        return identityId;
    }

    @Override
    public Map<String, String> getDetails() {
        return Map.of("identity_id", identityId.toString());
    }
}

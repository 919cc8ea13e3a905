package com.flagship.account_ledger.error;

import com.flagship.account_ledger.ledger.LedgerIds;

import java.util.Map;
import java.util.UUID;

/**
 * The account id derived for an identity already belongs to another identity.
 */
public class AccountIdCollisionException extends BankingException {

    private final long accountId;

    public AccountIdCollisionException(UUID identityId, long accountId, UUID owner, Throwable cause) {
        super(ErrorKind.ACCOUNT_ID_COLLISION,
            String.format("Account id %s derived for identity %s is owned by identity %s",
                LedgerIds.format(accountId), identityId, owner), cause);
        this.accountId = accountId;
    }

    public long getAccountId() {
        return accountId;
    }

    @Override
    public Map<String, String> getDetails() {
        return Map.of("account_id", LedgerIds.format(accountId));
    }
}

package com.flagship.account_ledger.error;

import com.flagship.account_ledger.ledger.LedgerIds;

import java.util.Map;
import java.util.UUID;

/**
 * The ledger account exists but the identity does not point at it.
 * Recovery is to retry the link write alone; the account must not be recreated.
 */
public class ProvisionPartialFailureException extends BankingException {

    private final UUID identityId;
    private final long accountId;

    public ProvisionPartialFailureException(UUID identityId, long accountId, Throwable cause) {
        super(ErrorKind.PROVISION_PARTIAL_FAILURE,
            String.format("Ledger account %s created but not linked to identity %s",
                LedgerIds.format(accountId), identityId), cause);
        this.identityId = identityId;
        this.accountId = accountId;
    }

    public UUID getIdentityId() {
        return identityId;
    }

    public long getAccountId() {
        return accountId;
    }

    @Override
    public Map<String, String> getDetails() {
        return Map.of("identity_id", identityId.toString(), "account_id", LedgerIds.format(accountId));
    }
}

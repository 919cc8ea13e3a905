package com.flagship.account_ledger.identity;

import com.flagship.account_ledger.error.BankingException;
import com.flagship.account_ledger.error.ErrorKind;
import com.flagship.account_ledger.ledger.LedgerIds;

import java.util.UUID;

public class IdentityNotFoundException extends BankingException {

    public IdentityNotFoundException(UUID identityId) {
        super(ErrorKind.IDENTITY_NOT_FOUND, "Identity not found: " + identityId);
    }

    private IdentityNotFoundException(String message) {
        super(ErrorKind.IDENTITY_NOT_FOUND, message);
    }

    public static IdentityNotFoundException forLedgerAccount(long accountId) {
        return new IdentityNotFoundException("No identity owns ledger account " + LedgerIds.format(accountId));
    }
}

package com.flagship.account_ledger.ledger;

/**
 * The account identifier is already taken. Not necessarily an error for the caller.
 */
public class AccountExistsException extends LedgerException {

    private final long accountId;

    public AccountExistsException(long accountId) {
        super("Ledger account already exists: " + LedgerIds.format(accountId));
        this.accountId = accountId;
    }

    public long getAccountId() {
        return accountId;
    }
}

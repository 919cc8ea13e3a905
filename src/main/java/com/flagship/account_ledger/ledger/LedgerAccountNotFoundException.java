package com.flagship.account_ledger.ledger;

public class LedgerAccountNotFoundException extends LedgerException {

    private final long accountId;

    public LedgerAccountNotFoundException(long accountId) {
        super("Ledger account not found: " + LedgerIds.format(accountId));
        this.accountId = accountId;
    }

    public long getAccountId() {
        return accountId;
    }
}

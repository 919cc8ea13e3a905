package com.flagship.account_ledger.error;

import com.flagship.account_ledger.ledger.LedgerIds;

import java.util.Map;

/**
 * Raised by the pre-flight balance check, or when the engine rejects a debit that lost a
 * race against a concurrent one.
 */
public class InsufficientFundsException extends BankingException {

    private final long accountId;
    private final long requested;

    public InsufficientFundsException(long accountId, long balance, long requested) {
        super(ErrorKind.INSUFFICIENT_FUNDS,
            String.format("Insufficient funds: balance %d, requested %d", balance, requested));
        this.accountId = accountId;
        this.requested = requested;
    }

    public InsufficientFundsException(long accountId, long requested, Throwable cause) {
        super(ErrorKind.INSUFFICIENT_FUNDS,
            String.format("Insufficient funds: requested %d exceeds available balance", requested), cause);
        this.accountId = accountId;
        this.requested = requested;
    }

    public long getAccountId() {
        return accountId;
    }

    public long getRequested() {
        return requested;
    }

    @Override
    public Map<String, String> getDetails() {
        return Map.of("account_id", LedgerIds.format(accountId), "requested", String.valueOf(requested));
    }
}

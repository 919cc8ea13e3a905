package com.flagship.account_ledger.ledger;

/**
 * The engine could not be reached or failed while serving the call.
 * The outcome of a write that fails this way is unknown.
 */
public class LedgerUnavailableException extends LedgerException {

    public LedgerUnavailableException(String operation, Throwable cause) {
        super("Ledger engine call failed: " + operation, cause);
    }
}

package com.flagship.account_ledger.ledger;

/**
 * Base type for failures reported by {@link LedgerGateway}.
 */
public abstract class LedgerException extends RuntimeException {

    protected LedgerException(String message) {
        super(message);
    }

    protected LedgerException(String message, Throwable cause) {
        super(message, cause);
    }
}

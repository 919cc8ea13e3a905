package com.flagship.account_ledger.error;

import java.util.Map;

/**
 * Base type for typed failures returned to the HTTP layer.
 */
public abstract class BankingException extends RuntimeException {

    private final ErrorKind kind;

    protected BankingException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected BankingException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    /**
     * Extra fields worth returning to the caller, e.g. ids needed for reconciliation.
     */
    public Map<String, String> getDetails() {
        return Map.of();
    }
}

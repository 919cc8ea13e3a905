package com.flagship.account_ledger.error;

public class EngineUnavailableException extends BankingException {

    public EngineUnavailableException(String operation, Throwable cause) {
        super(ErrorKind.ENGINE_UNAVAILABLE, "Ledger engine unavailable during " + operation, cause);
    }
}

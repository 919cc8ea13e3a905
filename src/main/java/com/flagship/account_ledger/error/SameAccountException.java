package com.flagship.account_ledger.error;

public class SameAccountException extends BankingException {

    public SameAccountException() {
        super(ErrorKind.SAME_ACCOUNT, "Source and destination must be different");
    }
}

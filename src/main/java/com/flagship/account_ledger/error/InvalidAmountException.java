package com.flagship.account_ledger.error;

public class InvalidAmountException extends BankingException {

    public InvalidAmountException(long amount) {
        super(ErrorKind.INVALID_AMOUNT, "Amount must be greater than 0, got " + amount);
    }
}

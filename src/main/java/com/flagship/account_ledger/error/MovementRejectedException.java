package com.flagship.account_ledger.error;

/**
 * The engine refused a transfer for a reason other than insufficient funds.
 * Nothing was posted.
 */
public class MovementRejectedException extends BankingException {

    public MovementRejectedException(String message, Throwable cause) {
        super(ErrorKind.TRANSFER_REJECTED, message, cause);
    }
}

package com.flagship.account_ledger.ledger;

/**
 * The engine refused a transfer because of one of its own business rules.
 */
public class TransferRejectedException extends LedgerException {

    public enum Reason {
        /** Debit side carries {@link LedgerAccount#DEBITS_MUST_NOT_EXCEED_CREDITS}. */
        EXCEEDS_CREDITS,
        ACCOUNTS_MUST_BE_DIFFERENT,
        AMOUNT_MUST_BE_POSITIVE,
        /** A storage constraint failed (e.g. a posted counter would overflow); nothing was applied. */
        CONSTRAINT_VIOLATED
    }

    private final long transferId;
    private final Reason reason;

    public TransferRejectedException(long transferId, Reason reason) {
        super(String.format("Ledger transfer %s rejected: %s", LedgerIds.format(transferId), reason));
        this.transferId = transferId;
        this.reason = reason;
    }

    public long getTransferId() {
        return transferId;
    }

    public Reason getReason() {
        return reason;
    }
}

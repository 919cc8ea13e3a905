package com.flagship.account_ledger.ledger;

/**
 * The transfer identifier was accepted earlier. Nothing was posted by this call.
 */
public class TransferExistsException extends LedgerException {

    private final long transferId;

    public TransferExistsException(long transferId) {
        super("Ledger transfer already exists: " + LedgerIds.format(transferId));
        this.transferId = transferId;
    }

    public long getTransferId() {
        return transferId;
    }
}

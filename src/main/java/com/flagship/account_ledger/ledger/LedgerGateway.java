package com.flagship.account_ledger.ledger;

import java.util.Optional;

/**
 * Narrow interface to the double-entry ledger engine.
 *
 * Every method is a single call to the engine and may fail independently of the identity
 * directory. Implementations must be safe for concurrent use.
 */
public interface LedgerGateway {

    /**
     * Creates an account with zero posted totals.
     *
     * @throws AccountExistsException if the identifier is taken
     * @throws LedgerUnavailableException on transport or engine failure
     */
    LedgerAccount createAccount(long accountId, AccountCategory category);

    /**
     * @throws LedgerAccountNotFoundException if no such account exists
     */
    LedgerAccount getAccount(long accountId);

    /**
     * Atomically posts {@code amount} to the debit side of one account and the credit side of
     * another.
     *
     * @throws TransferExistsException if the transfer id was accepted before; nothing is posted
     * @throws LedgerAccountNotFoundException if either account is unknown
     * @throws TransferRejectedException if an engine rule rejects the transfer
     * @throws LedgerUnavailableException on transport or engine failure
     */
    void createTransfer(long transferId, long debitAccountId, long creditAccountId, long amount);

    /**
     * @throws LedgerAccountNotFoundException if no such account exists
     */
    PostedTotals getPostedTotals(long accountId);

    /**
     * Looks up an accepted transfer, used to tell a genuine retry from an id clash.
     */
    Optional<LedgerTransfer> findTransfer(long transferId);
}

package com.flagship.account_ledger.error;

import com.flagship.account_ledger.ledger.LedgerIds;

import java.util.Map;

/**
 * The engine already holds a transfer with this id, so nothing was posted by this request.
 *
 * {@link #isMatchingOriginal()} tells whether the stored transfer has the same accounts and
 * amount as this request, which is what a caller needs to treat the outcome as a retry of an
 * operation that was already applied.
 */
public class DuplicateSubmissionException extends BankingException {

    private final long transferId;
    private final boolean matchingOriginal;

    public DuplicateSubmissionException(long transferId, boolean matchingOriginal, Throwable cause) {
        super(ErrorKind.DUPLICATE_SUBMISSION,
            "Transfer " + LedgerIds.format(transferId) + " was already submitted", cause);
        this.transferId = transferId;
        this.matchingOriginal = matchingOriginal;
    }

    public long getTransferId() {
        return transferId;
    }

    public boolean isMatchingOriginal() {
        return matchingOriginal;
    }

    @Override
    public Map<String, String> getDetails() {
        return Map.of(
            "transfer_id", LedgerIds.format(transferId),
            "matching_original", String.valueOf(matchingOriginal)
        );
    }
}

package com.flagship.account_ledger.ledger;

import lombok.Value;

/**
 * Snapshot of an account held by the ledger engine.
 *
 * The posted counters only ever grow. The balance is derived, never stored.
 */
@Value
public class LedgerAccount {

    /** Engine rejects any transfer that would push debits_posted above credits_posted. */
    public static final int DEBITS_MUST_NOT_EXCEED_CREDITS = 1 << 1;

    long id;
    int ledger;
    AccountCategory category;
    int flags;
    long debitsPosted;
    long creditsPosted;

    public boolean hasFlag(int flag) {
        return (flags & flag) != 0;
    }

    public PostedTotals postedTotals() {
        return new PostedTotals(debitsPosted, creditsPosted);
    }
}

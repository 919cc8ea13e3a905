package com.flagship.account_ledger.ledger;

import lombok.Value;

/**
 * Cumulative debit and credit amounts posted against an account, in minor units.
 */
@Value
public class PostedTotals {
    long debitsPosted;
    long creditsPosted;

    /**
     * credits_posted - debits_posted. Negative only for accounts without the
     * debits-must-not-exceed-credits flag (master accounts).
     */
    public long balance() {
        return creditsPosted - debitsPosted;
    }

    public boolean covers(long amount) {
        return balance() >= amount;
    }
}

package com.flagship.account_ledger.ledger;

import lombok.Value;

import java.time.Instant;

/**
 * Immutable transfer record as accepted by the ledger engine.
 */
@Value
public class LedgerTransfer {

    /** Code recorded on every transfer submitted by this service. */
    public static final int STANDARD_CODE = 1;

    long id;
    long debitAccountId;
    long creditAccountId;
    long amount;
    int ledger;
    int code;
    Instant createdAt;

    public boolean sameMovement(long debitAccountId, long creditAccountId, long amount) {
        return this.debitAccountId == debitAccountId
            && this.creditAccountId == creditAccountId
            && this.amount == amount;
    }
}

package com.flagship.account_ledger.movement;

import lombok.Value;

/**
 * Outcome of a money movement accepted by the ledger engine.
 */
@Value
public class MovementReceipt {
    long transferId;
    MovementType type;
    long debitAccountId;
    long creditAccountId;
    long amount;
}

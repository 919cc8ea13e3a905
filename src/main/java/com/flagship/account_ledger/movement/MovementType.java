package com.flagship.account_ledger.movement;

public enum MovementType {
    DEPOSIT,
    WITHDRAWAL,
    TRANSFER
}

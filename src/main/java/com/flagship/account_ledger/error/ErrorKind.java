package com.flagship.account_ledger.error;

/**
 * Failure kinds surfaced by the provisioning and money movement operations.
 */
public enum ErrorKind {
    INVALID_AMOUNT,
    ACCOUNT_NOT_LINKED,
    INSUFFICIENT_FUNDS,
    SAME_ACCOUNT,
    /** Ledger call failed; the outcome of a write is unknown. */
    ENGINE_UNAVAILABLE,
    /** Transfer id already accepted; the movement may have been applied before. */
    DUPLICATE_SUBMISSION,
    /** Ledger account created but not linked to the identity. Needs operator follow-up. */
    PROVISION_PARTIAL_FAILURE,
    IDENTITY_NOT_FOUND,
    ACCOUNT_ID_COLLISION,
    TRANSFER_REJECTED
}

package com.flagship.account_ledger.ledger;

import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.UUID;

/**
 * Derivation of ledger-native numeric identifiers.
 *
 * Account and transfer identifiers are unsigned 64-bit values held in a Java {@code long}
 * (same bit pattern). Both are the most-significant 8 bytes of a 128-bit UUID read as a
 * big-endian integer.
 *
 * The truncation is NOT collision resistant: two distinct identities can map to the same
 * account identifier. {@link com.flagship.account_ledger.account.AccountProvisioner} detects
 * that case when the ledger reports the account as already existing.
 */
public final class LedgerIds {

    /** Sink for withdrawals. */
    public static final long MASTER_DEBIT_ACCOUNT_ID = 1L;

    /** Source for deposits. */
    public static final long MASTER_CREDIT_ACCOUNT_ID = 2L;

    /** Added to a derived account id that falls on 0 or a master account id. */
    public static final long RESERVED_OFFSET = 1000L;

    private LedgerIds() {
        // Utility class
    }

    /**
     * Derives the ledger account id for an identity. Pure and deterministic.
     */
    public static long accountIdFor(UUID identityId) {
        Objects.requireNonNull(identityId, "identityId");
        long accountId = identityId.getMostSignificantBits();
        if (Long.compareUnsigned(accountId, MASTER_CREDIT_ACCOUNT_ID) <= 0) {
            accountId += RESERVED_OFFSET;
        }
        return accountId;
    }

    /**
     * Generates a fresh transfer id from a random UUID.
     * The version nibble of a random UUID is non-zero, so the result is never 0.
     */
    public static long newTransferId() {
        return UUID.randomUUID().getMostSignificantBits();
    }

    /**
     * Derives a stable transfer id from a caller-supplied idempotency key, so that a retried
     * request reuses the identifier of the first attempt.
     */
    public static long transferIdFor(String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("Idempotency key cannot be null or blank");
        }
        byte[] name = ("transfer:" + idempotencyKey).getBytes(StandardCharsets.UTF_8);
        return UUID.nameUUIDFromBytes(name).getMostSignificantBits();
    }

    public static boolean isMasterAccount(long accountId) {
        return accountId == MASTER_DEBIT_ACCOUNT_ID || accountId == MASTER_CREDIT_ACCOUNT_ID;
    }

    /**
     * Renders an id as the unsigned decimal the ledger engine uses.
     */
    public static String format(long id) {
        return Long.toUnsignedString(id);
    }

    public static long parse(String id) {
        return Long.parseUnsignedLong(id);
    }
}

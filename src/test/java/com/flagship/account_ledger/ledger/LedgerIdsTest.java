package com.flagship.account_ledger.ledger;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class LedgerIdsTest {

    @Test
    @DisplayName("Account id is the high 64 bits of the identity UUID")
    void accountIdUsesMostSignificantBits() {
        UUID identityId = UUID.fromString("01234567-89ab-cdef-fedc-ba9876543210");

        assertEquals(0x0123456789abcdefL, LedgerIds.accountIdFor(identityId));
        assertEquals("81985529216486895", LedgerIds.format(LedgerIds.accountIdFor(identityId)));
    }

    @Test
    @DisplayName("Derivation is deterministic")
    void accountIdIsDeterministic() {
        UUID id = UUID.randomUUID();
        assertEquals(LedgerIds.accountIdFor(id), LedgerIds.accountIdFor(UUID.fromString(id.toString())));
    }

    @Test
    @DisplayName("Reserved values 0, 1 and 2 are shifted by the reserved offset")
    void reservedValuesAreShifted() {
        assertEquals(1000L, LedgerIds.accountIdFor(new UUID(0L, 42L)));
        assertEquals(1001L, LedgerIds.accountIdFor(new UUID(1L, 42L)));
        assertEquals(1002L, LedgerIds.accountIdFor(new UUID(2L, 42L)));
        assertEquals(3L, LedgerIds.accountIdFor(new UUID(3L, 42L)));
    }

    @Test
    @DisplayName("High bits above 2^63 are compared unsigned and never shifted")
    void largeUnsignedValuesAreKept() {
        UUID id = new UUID(0xffffffffffffffffL, 0L);
        long accountId = LedgerIds.accountIdFor(id);

        assertEquals(-1L, accountId);
        assertEquals("18446744073709551615", LedgerIds.format(accountId));
        assertFalse(LedgerIds.isMasterAccount(accountId));
    }

    @Test
    @DisplayName("Derived user account ids never hit a master account id")
    void derivedIdsAreNeverMaster() {
        for (long high = 0; high < 10; high++) {
            long accountId = LedgerIds.accountIdFor(new UUID(high, 7L));
            assertNotEquals(0L, accountId);
            assertFalse(LedgerIds.isMasterAccount(accountId));
        }
    }

    @Test
    @DisplayName("Null identity id is rejected")
    void nullIdentityIsRejected() {
        assertThrows(NullPointerException.class, () -> LedgerIds.accountIdFor(null));
    }

    @Test
    @DisplayName("Fresh transfer ids are non-zero and distinct")
    void newTransferIdsAreUnique() {
        Set<Long> ids = new HashSet<>();
        for (int i = 0; i < 1000; i++) {
            long id = LedgerIds.newTransferId();
            assertNotEquals(0L, id);
            ids.add(id);
        }
        assertEquals(1000, ids.size());
    }

    @Test
    @DisplayName("Idempotency keys map to stable transfer ids")
    void idempotencyKeyDerivation() {
        assertEquals(LedgerIds.transferIdFor("order-17"), LedgerIds.transferIdFor("order-17"));
        assertNotEquals(LedgerIds.transferIdFor("order-17"), LedgerIds.transferIdFor("order-18"));
        assertThrows(IllegalArgumentException.class, () -> LedgerIds.transferIdFor(" "));
        assertThrows(IllegalArgumentException.class, () -> LedgerIds.transferIdFor(null));
    }

    @Test
    @DisplayName("Unsigned formatting round-trips")
    void formatAndParse() {
        long id = 0x8000000000000001L;
        assertEquals("9223372036854775809", LedgerIds.format(id));
        assertEquals(id, LedgerIds.parse("9223372036854775809"));
    }
}

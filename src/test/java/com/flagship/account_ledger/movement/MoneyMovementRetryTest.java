package com.flagship.account_ledger.movement;

import com.flagship.account_ledger.error.DuplicateSubmissionException;
import com.flagship.account_ledger.error.EngineUnavailableException;
import com.flagship.account_ledger.error.InsufficientFundsException;
import com.flagship.account_ledger.identity.Identity;
import com.flagship.account_ledger.identity.IdentityDirectory;
import com.flagship.account_ledger.ledger.LedgerGateway;
import com.flagship.account_ledger.ledger.LedgerIds;
import com.flagship.account_ledger.ledger.LedgerTransfer;
import com.flagship.account_ledger.ledger.LedgerUnavailableException;
import com.flagship.account_ledger.ledger.PostedTotals;
import com.flagship.account_ledger.observability.LedgerMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.*;

/**
 * Retries of debits whose first attempt already spent the balance.
 */
class MoneyMovementRetryTest {

    private static final long ACCOUNT_ID = 5000L;
    private static final long TRANSFER_ID = 77L;

    private LedgerGateway ledgerGateway;
    private MoneyMovementService moneyMovementService;

    private final UUID identityId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        IdentityDirectory identityDirectory = mock(IdentityDirectory.class);
        ledgerGateway = mock(LedgerGateway.class);
        moneyMovementService = new MoneyMovementService(
            identityDirectory, ledgerGateway, new LedgerMetrics(new SimpleMeterRegistry()));

        Instant now = Instant.now();
        when(identityDirectory.getIdentity(identityId))
            .thenReturn(new Identity(identityId, "user@example.com", "Test User", ACCOUNT_ID, now, now));
        // Drained by the first attempt
        when(ledgerGateway.getPostedTotals(ACCOUNT_ID)).thenReturn(new PostedTotals(5000, 5000));
    }

    private static LedgerTransfer withdrawal(long amount) {
        return new LedgerTransfer(TRANSFER_ID, ACCOUNT_ID, LedgerIds.MASTER_DEBIT_ACCOUNT_ID,
                amount, 1, LedgerTransfer.STANDARD_CODE, Instant.now());
    }

    @Test
    @DisplayName("Applied withdrawal retried with the same id is a matching duplicate")
    void appliedWithdrawalRetried() {
        when(ledgerGateway.findTransfer(TRANSFER_ID)).thenReturn(Optional.of(withdrawal(5000)));

        DuplicateSubmissionException e = assertThrows(DuplicateSubmissionException.class,
            () -> moneyMovementService.withdraw(identityId, 5000, TRANSFER_ID));

        assertTrue(e.isMatchingOriginal());
        assertEquals(TRANSFER_ID, e.getTransferId());
        verify(ledgerGateway, never()).createTransfer(anyLong(), anyLong(), anyLong(), anyLong());
    }

    @Test
    @DisplayName("Same id carrying a different amount is a non-matching duplicate")
    void differentAmountRetried() {
        when(ledgerGateway.findTransfer(TRANSFER_ID)).thenReturn(Optional.of(withdrawal(4000)));

        DuplicateSubmissionException e = assertThrows(DuplicateSubmissionException.class,
            () -> moneyMovementService.withdraw(identityId, 5000, TRANSFER_ID));

        assertFalse(e.isMatchingOriginal());
    }

    @Test
    @DisplayName("Unknown id on an empty account is insufficient funds")
    void unknownIdInsufficient() {
        when(ledgerGateway.findTransfer(TRANSFER_ID)).thenReturn(Optional.empty());

        assertThrows(InsufficientFundsException.class,
            () -> moneyMovementService.withdraw(identityId, 5000, TRANSFER_ID));
    }

    @Test
    @DisplayName("Failed lookup reports the engine as unavailable instead of guessing")
    void lookupFails() {
        when(ledgerGateway.findTransfer(TRANSFER_ID))
            .thenThrow(new LedgerUnavailableException("findTransfer", new RuntimeException("down")));

        assertThrows(EngineUnavailableException.class,
            () -> moneyMovementService.withdraw(identityId, 5000, TRANSFER_ID));
    }
}

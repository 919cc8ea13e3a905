package com.flagship.account_ledger.account;

import com.flagship.account_ledger.error.AccountIdCollisionException;
import com.flagship.account_ledger.error.EngineUnavailableException;
import com.flagship.account_ledger.error.ProvisionPartialFailureException;
import com.flagship.account_ledger.identity.Identity;
import com.flagship.account_ledger.identity.IdentityDirectory;
import com.flagship.account_ledger.identity.IdentityNotFoundException;
import com.flagship.account_ledger.identity.IdentityRegistration;
import com.flagship.account_ledger.ledger.AccountCategory;
import com.flagship.account_ledger.ledger.AccountExistsException;
import com.flagship.account_ledger.ledger.LedgerGateway;
import com.flagship.account_ledger.ledger.LedgerIds;
import com.flagship.account_ledger.ledger.LedgerUnavailableException;
import com.flagship.account_ledger.observability.LedgerMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.*;

/**
 * Provisioning saga against mocked collaborators: every failure point of the two steps.
 */
class AccountProvisionerTest {

    private LedgerGateway ledgerGateway;
    private IdentityDirectory identityDirectory;
    private SimpleMeterRegistry meterRegistry;
    private AccountProvisioner provisioner;

    private UUID identityId;
    private long accountId;

    @BeforeEach
    void setUp() {
        ledgerGateway = mock(LedgerGateway.class);
        identityDirectory = mock(IdentityDirectory.class);
        meterRegistry = new SimpleMeterRegistry();
        provisioner = new AccountProvisioner(ledgerGateway, identityDirectory, new LedgerMetrics(meterRegistry));

        identityId = UUID.randomUUID();
        accountId = LedgerIds.accountIdFor(identityId);
    }

    private static Identity identity(UUID id, Long ledgerAccountId) {
        Instant now = Instant.now();
        return new Identity(id, "user@example.com", "Test User", ledgerAccountId, now, now);
    }

    private double provisioningCount(String status) {
        return meterRegistry.counter("ledger.provisioning", "status", status).count();
    }

    @Nested
    @DisplayName("Happy path")
    class HappyPath {

        @Test
        @DisplayName("Creates the derived account and links it")
        void provisions() {
            long result = provisioner.provision(identityId);

            assertEquals(accountId, result);
            verify(ledgerGateway).createAccount(accountId, AccountCategory.USER);
            verify(identityDirectory).setLedgerLink(identityId, accountId);
            verify(identityDirectory, never()).deleteIdentity(any());
            assertEquals(1.0, provisioningCount("success"));
        }

        @Test
        @DisplayName("Register creates the identity, then provisions it")
        void registerWithAccount() {
            IdentityRegistration registration = new IdentityRegistration("user@example.com", "password1", "Test User");
            when(identityDirectory.createIdentity(registration)).thenReturn(identity(identityId, null));

            Identity result = provisioner.registerWithAccount(registration);

            assertEquals(accountId, result.getLedgerAccountId());
            verify(ledgerGateway).createAccount(accountId, AccountCategory.USER);
        }

        @Test
        @DisplayName("Existing unowned account resumes at the link step")
        void resumesAfterPartialFailure() {
            when(ledgerGateway.createAccount(accountId, AccountCategory.USER))
                .thenThrow(new AccountExistsException(accountId));
            when(identityDirectory.findByLedgerAccountId(accountId)).thenReturn(Optional.empty());

            assertEquals(accountId, provisioner.provision(identityId));
            verify(identityDirectory).setLedgerLink(identityId, accountId);
        }

        @Test
        @DisplayName("Existing account already owned by the same identity is accepted")
        void resumesWhenAlreadyOwned() {
            when(ledgerGateway.createAccount(accountId, AccountCategory.USER))
                .thenThrow(new AccountExistsException(accountId));
            when(identityDirectory.findByLedgerAccountId(accountId))
                .thenReturn(Optional.of(identity(identityId, accountId)));

            assertEquals(accountId, provisioner.provision(identityId));
            verify(identityDirectory, never()).deleteIdentity(any());
        }
    }

    @Nested
    @DisplayName("Ledger failures")
    class LedgerFailures {

        @Test
        @DisplayName("Engine error deletes the identity and surfaces EngineUnavailable")
        void engineErrorCompensates() {
            LedgerUnavailableException cause = new LedgerUnavailableException("createAccount", new RuntimeException("down"));
            when(ledgerGateway.createAccount(accountId, AccountCategory.USER)).thenThrow(cause);

            EngineUnavailableException e = assertThrows(EngineUnavailableException.class,
                () -> provisioner.provision(identityId));

            assertSame(cause, e.getCause());
            verify(identityDirectory).deleteIdentity(identityId);
            verify(identityDirectory, never()).setLedgerLink(any(), anyLong());
            assertEquals(1.0, meterRegistry.counter("ledger.compensations", "status", "success").count());
        }

        @Test
        @DisplayName("Failed compensation still surfaces the ledger error with the delete failure attached")
        void failedCompensation() {
            when(ledgerGateway.createAccount(accountId, AccountCategory.USER))
                .thenThrow(new LedgerUnavailableException("createAccount", new RuntimeException("down")));
            RuntimeException deleteFailure = new RuntimeException("directory down");
            doThrow(deleteFailure).when(identityDirectory).deleteIdentity(identityId);

            EngineUnavailableException e = assertThrows(EngineUnavailableException.class,
                () -> provisioner.provision(identityId));

            assertEquals(1, e.getSuppressed().length);
            assertSame(deleteFailure, e.getSuppressed()[0]);
            assertEquals(1.0, meterRegistry.counter("ledger.compensations", "status", "failure").count());
        }

        @Test
        @DisplayName("Account owned by another identity is a collision and compensates")
        void collision() {
            UUID otherIdentity = UUID.randomUUID();
            when(ledgerGateway.createAccount(accountId, AccountCategory.USER))
                .thenThrow(new AccountExistsException(accountId));
            when(identityDirectory.findByLedgerAccountId(accountId))
                .thenReturn(Optional.of(identity(otherIdentity, accountId)));

            AccountIdCollisionException e = assertThrows(AccountIdCollisionException.class,
                () -> provisioner.provision(identityId));

            assertEquals(accountId, e.getAccountId());
            verify(identityDirectory).deleteIdentity(identityId);
            verify(identityDirectory, never()).setLedgerLink(any(), anyLong());
        }
    }

    @Nested
    @DisplayName("Link failures")
    class LinkFailures {

        @Test
        @DisplayName("Link write failure is a partial failure carrying the account id; nothing is deleted")
        void linkFailure() {
            doThrow(new RuntimeException("directory timeout"))
                .when(identityDirectory).setLedgerLink(identityId, accountId);

            ProvisionPartialFailureException e = assertThrows(ProvisionPartialFailureException.class,
                () -> provisioner.provision(identityId));

            assertEquals(identityId, e.getIdentityId());
            assertEquals(accountId, e.getAccountId());
            verify(identityDirectory, never()).deleteIdentity(any());
            assertEquals(1.0, provisioningCount("partial_failure"));
        }

        @Test
        @DisplayName("Owner lookup failure after AccountExists is a partial failure")
        void ownerLookupFailure() {
            when(ledgerGateway.createAccount(accountId, AccountCategory.USER))
                .thenThrow(new AccountExistsException(accountId));
            when(identityDirectory.findByLedgerAccountId(accountId))
                .thenThrow(new RuntimeException("directory down"));

            assertThrows(ProvisionPartialFailureException.class, () -> provisioner.provision(identityId));
            verify(identityDirectory, never()).deleteIdentity(any());
        }
    }

    @Nested
    @DisplayName("Associate")
    class Associate {

        @Test
        @DisplayName("Links an account to an existing unlinked identity")
        void associates() {
            when(identityDirectory.getIdentity(identityId)).thenReturn(identity(identityId, null));

            assertEquals(accountId, provisioner.associate(identityId));
            verify(identityDirectory).setLedgerLink(identityId, accountId);
        }

        @Test
        @DisplayName("Refuses an identity that is already linked")
        void alreadyLinked() {
            when(identityDirectory.getIdentity(identityId)).thenReturn(identity(identityId, accountId));

            assertThrows(IllegalStateException.class, () -> provisioner.associate(identityId));
            verifyNoInteractions(ledgerGateway);
        }

        @Test
        @DisplayName("Unknown identity is reported as not found")
        void unknownIdentity() {
            when(identityDirectory.getIdentity(identityId)).thenThrow(new IdentityNotFoundException(identityId));

            assertThrows(IdentityNotFoundException.class, () -> provisioner.associate(identityId));
        }

        @Test
        @DisplayName("Engine error does not delete a pre-existing identity")
        void noCompensation() {
            when(identityDirectory.getIdentity(identityId)).thenReturn(identity(identityId, null));
            when(ledgerGateway.createAccount(accountId, AccountCategory.USER))
                .thenThrow(new LedgerUnavailableException("createAccount", new RuntimeException("down")));

            assertThrows(EngineUnavailableException.class, () -> provisioner.associate(identityId));
            verify(identityDirectory, never()).deleteIdentity(any());
        }
    }
}

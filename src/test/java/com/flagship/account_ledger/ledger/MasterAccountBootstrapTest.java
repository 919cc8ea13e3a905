package com.flagship.account_ledger.ledger;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.*;

class MasterAccountBootstrapTest {

    private LedgerGateway ledgerGateway;

    @BeforeEach
    void setUp() {
        ledgerGateway = mock(LedgerGateway.class);
    }

    @Test
    @DisplayName("Creates both master accounts on a fresh ledger")
    void createsBothAccounts() {
        MasterAccountBootstrap bootstrap = new MasterAccountBootstrap(ledgerGateway, true);

        bootstrap.afterPropertiesSet();

        verify(ledgerGateway).createAccount(LedgerIds.MASTER_DEBIT_ACCOUNT_ID, AccountCategory.MASTER_DEBIT);
        verify(ledgerGateway).createAccount(LedgerIds.MASTER_CREDIT_ACCOUNT_ID, AccountCategory.MASTER_CREDIT);
        assertTrue(bootstrap.getUnresolvedAccounts().isEmpty());
    }

    @Test
    @DisplayName("Accounts that already exist count as success")
    void existingAccountsAreFine() {
        when(ledgerGateway.createAccount(anyLong(), any()))
            .thenThrow(new AccountExistsException(LedgerIds.MASTER_DEBIT_ACCOUNT_ID))
            .thenThrow(new AccountExistsException(LedgerIds.MASTER_CREDIT_ACCOUNT_ID));
        MasterAccountBootstrap bootstrap = new MasterAccountBootstrap(ledgerGateway, true);

        assertTrue(bootstrap.ensureMasterAccounts());
        assertTrue(bootstrap.getUnresolvedAccounts().isEmpty());
    }

    @Test
    @DisplayName("Engine failure is logged, startup continues and the account stays unresolved")
    void engineFailureIsTolerated() {
        when(ledgerGateway.createAccount(LedgerIds.MASTER_DEBIT_ACCOUNT_ID, AccountCategory.MASTER_DEBIT))
            .thenThrow(new LedgerUnavailableException("createAccount", new RuntimeException("connection refused")));
        MasterAccountBootstrap bootstrap = new MasterAccountBootstrap(ledgerGateway, true);

        assertDoesNotThrow(bootstrap::afterPropertiesSet);

        verify(ledgerGateway).createAccount(LedgerIds.MASTER_CREDIT_ACCOUNT_ID, AccountCategory.MASTER_CREDIT);
        assertEquals(Set.of(LedgerIds.MASTER_DEBIT_ACCOUNT_ID), bootstrap.getUnresolvedAccounts());
    }

    @Test
    @DisplayName("A later successful run clears unresolved accounts")
    void rerunResolves() {
        when(ledgerGateway.createAccount(LedgerIds.MASTER_CREDIT_ACCOUNT_ID, AccountCategory.MASTER_CREDIT))
            .thenThrow(new LedgerUnavailableException("createAccount", new RuntimeException("timeout")))
            .thenThrow(new AccountExistsException(LedgerIds.MASTER_CREDIT_ACCOUNT_ID));
        MasterAccountBootstrap bootstrap = new MasterAccountBootstrap(ledgerGateway, true);

        assertFalse(bootstrap.ensureMasterAccounts());
        assertTrue(bootstrap.ensureMasterAccounts());
        assertTrue(bootstrap.getUnresolvedAccounts().isEmpty());
    }

    @Test
    @DisplayName("Disabled bootstrap does not touch the ledger")
    void disabled() {
        MasterAccountBootstrap bootstrap = new MasterAccountBootstrap(ledgerGateway, false);

        bootstrap.afterPropertiesSet();

        verifyNoInteractions(ledgerGateway);
    }
}

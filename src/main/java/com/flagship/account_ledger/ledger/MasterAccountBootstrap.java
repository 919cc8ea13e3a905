package com.flagship.account_ledger.ledger;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Ensures the two clearing accounts exist before any request is served.
 *
 * Runs while the application context is being refreshed, so it completes before the web
 * server starts accepting connections. The operation is idempotent: an account that already
 * exists counts as success. Any other failure is logged and left unresolved; startup carries
 * on, because accounts created by an earlier run already satisfy the invariant.
 */
@Component
@Slf4j
public class MasterAccountBootstrap implements InitializingBean {

    private final LedgerGateway ledgerGateway;
    private final boolean enabled;
    private final Set<Long> unresolved = Collections.synchronizedSet(new LinkedHashSet<>());

    public MasterAccountBootstrap(LedgerGateway ledgerGateway,
                                  @Value("${ledger.bootstrap.enabled:true}") boolean enabled) {
        this.ledgerGateway = ledgerGateway;
        this.enabled = enabled;
    }

    @Override
    public void afterPropertiesSet() {
        if (!enabled) {
            log.info("Master account bootstrap disabled");
            return;
        }
        ensureMasterAccounts();
    }

    /**
     * @return true if both master accounts are known to exist
     */
    public boolean ensureMasterAccounts() {
        ensure(LedgerIds.MASTER_DEBIT_ACCOUNT_ID, AccountCategory.MASTER_DEBIT);
        ensure(LedgerIds.MASTER_CREDIT_ACCOUNT_ID, AccountCategory.MASTER_CREDIT);

        if (unresolved.isEmpty()) {
            log.info("Master accounts initialized");
            return true;
        }
        log.warn("Master account bootstrap degraded, unresolved accounts: {}", unresolved);
        return false;
    }

    public Set<Long> getUnresolvedAccounts() {
        synchronized (unresolved) {
            return Set.copyOf(unresolved);
        }
    }

    private void ensure(long accountId, AccountCategory category) {
        try {
            ledgerGateway.createAccount(accountId, category);
            unresolved.remove(accountId);
            log.info("Created master account {} ({})", accountId, category);
        } catch (AccountExistsException e) {
            unresolved.remove(accountId);
            log.debug("Master account {} already exists", accountId);
        } catch (LedgerException e) {
            unresolved.add(accountId);
            log.warn("Could not create master account {} ({}): {}", accountId, category, e.getMessage());
        }
    }
}

package com.flagship.account_ledger.account;

import com.flagship.account_ledger.error.AccountIdCollisionException;
import com.flagship.account_ledger.error.EngineUnavailableException;
import com.flagship.account_ledger.error.ProvisionPartialFailureException;
import com.flagship.account_ledger.identity.Identity;
import com.flagship.account_ledger.identity.IdentityDirectory;
import com.flagship.account_ledger.identity.IdentityRegistration;
import com.flagship.account_ledger.ledger.AccountCategory;
import com.flagship.account_ledger.ledger.AccountExistsException;
import com.flagship.account_ledger.ledger.LedgerException;
import com.flagship.account_ledger.ledger.LedgerGateway;
import com.flagship.account_ledger.ledger.LedgerIds;
import com.flagship.account_ledger.observability.CorrelationContext;
import com.flagship.account_ledger.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.UUID;

/**
 * Creates the ledger account of an identity and links it back into the identity record.
 *
 * The identity directory and the ledger engine fail independently, so provisioning is a
 * two-step saga:
 * 1. Create the ledger account (id derived from the identity). If the engine fails, delete
 *    the identity record as compensation and surface the ledger error.
 * 2. Write the account id into the identity. If that fails, the account exists without an
 *    owner; surface {@link ProvisionPartialFailureException} with the account id. The account
 *    is never recreated: the recovery is to retry step 2 alone.
 *
 * Neither step is retried here. Compensation is best effort; a failed compensating delete is
 * logged and attached to the surfaced error as a suppressed exception.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccountProvisioner {

    private final LedgerGateway ledgerGateway;
    private final IdentityDirectory identityDirectory;
    private final LedgerMetrics ledgerMetrics;

    /**
     * Provisions the ledger account of an identity that already exists in the directory.
     *
     * An engine report that the account already exists is treated as a resumed provisioning
     * when no other identity owns the account, so a caller can safely re-run this after a
     * {@link ProvisionPartialFailureException}.
     *
     * @param identityId identity created by the caller just before provisioning
     * @return the linked ledger account id
     * @throws EngineUnavailableException if the ledger failed; the identity has been deleted
     * @throws AccountIdCollisionException if another identity owns the derived account id;
     *         the identity has been deleted
     * @throws ProvisionPartialFailureException if the account exists but linking failed
     */
    public long provision(UUID identityId) {
        return provision(identityId, true);
    }

    /**
     * Creates and links a ledger account for an existing identity that has none, without
     * deleting the identity on failure.
     *
     * @throws IllegalStateException if the identity is already linked
     */
    public long associate(UUID identityId) {
        Identity identity = identityDirectory.getIdentity(identityId);
        if (identity.isLinked()) {
            throw new IllegalStateException("Identity " + identityId + " already has a ledger account");
        }
        return provision(identityId, false);
    }

    /**
     * Registers a new identity and provisions its ledger account.
     */
    public Identity registerWithAccount(IdentityRegistration registration) {
        Identity identity = identityDirectory.createIdentity(registration);
        long accountId = provision(identity.getId());
        return identity.linkedTo(accountId);
    }

    private long provision(UUID identityId, boolean compensate) {
        long startTime = System.currentTimeMillis();
        long accountId = LedgerIds.accountIdFor(identityId);
        MDC.put(CorrelationContext.IDENTITY_ID_MDC_KEY, identityId.toString());
        MDC.put(CorrelationContext.ACCOUNT_ID_MDC_KEY, LedgerIds.format(accountId));

        try {
            try {
                ledgerGateway.createAccount(accountId, AccountCategory.USER);
                log.info("Created ledger account");
            } catch (AccountExistsException e) {
                resumeOrReject(identityId, accountId, compensate, e);
            } catch (LedgerException e) {
                ledgerMetrics.recordProvisioning("engine_error");
                log.error("Ledger account creation failed: {}", e.getMessage());
                EngineUnavailableException failure = new EngineUnavailableException("createAccount", e);
                if (compensate) {
                    compensate(identityId, failure);
                }
                throw failure;
            }

            link(identityId, accountId);

            long duration = System.currentTimeMillis() - startTime;
            ledgerMetrics.recordProvisioning("success");
            ledgerMetrics.recordLatency("provision", duration);
            log.info("Provisioned ledger account, duration={}ms", duration);
            return accountId;
        } finally {
            MDC.remove(CorrelationContext.IDENTITY_ID_MDC_KEY);
            MDC.remove(CorrelationContext.ACCOUNT_ID_MDC_KEY);
        }
    }

    /**
     * The derived account already exists. Continue to the link step if it is unowned or
     * already ours; otherwise two identities truncated to the same id.
     */
    private void resumeOrReject(UUID identityId, long accountId, boolean compensate, AccountExistsException cause) {
        Optional<Identity> owner;
        try {
            owner = identityDirectory.findByLedgerAccountId(accountId);
        } catch (RuntimeException e) {
            ledgerMetrics.recordProvisioning("partial_failure");
            log.error("Ledger account exists but its owner could not be checked: {}", e.getMessage());
            throw new ProvisionPartialFailureException(identityId, accountId, e);
        }

        if (owner.isEmpty() || owner.get().getId().equals(identityId)) {
            log.info("Ledger account already exists, resuming at link step");
            return;
        }

        ledgerMetrics.recordProvisioning("collision");
        log.error("Derived ledger account id is owned by identity {}", owner.get().getId());
        AccountIdCollisionException failure =
            new AccountIdCollisionException(identityId, accountId, owner.get().getId(), cause);
        if (compensate) {
            compensate(identityId, failure);
        }
        throw failure;
    }

    private void link(UUID identityId, long accountId) {
        try {
            identityDirectory.setLedgerLink(identityId, accountId);
        } catch (RuntimeException e) {
            ledgerMetrics.recordProvisioning("partial_failure");
            log.error("Ledger account created but link write failed, operator follow-up required: {}",
                    e.getMessage());
            throw new ProvisionPartialFailureException(identityId, accountId, e);
        }
    }

    private void compensate(UUID identityId, RuntimeException failure) {
        try {
            identityDirectory.deleteIdentity(identityId);
            ledgerMetrics.recordCompensation(true);
            log.warn("Rolled back identity {} after ledger failure", identityId);
        } catch (RuntimeException deleteError) {
            ledgerMetrics.recordCompensation(false);
            log.error("Compensating delete of identity {} failed: {}", identityId, deleteError.getMessage());
            failure.addSuppressed(deleteError);
        }
    }
}

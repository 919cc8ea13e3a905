package com.flagship.account_ledger.movement;

import com.flagship.account_ledger.identity.Identity;
import com.flagship.account_ledger.identity.IdentityDirectory;
import com.flagship.account_ledger.ledger.LedgerException;
import com.flagship.account_ledger.ledger.LedgerGateway;
import com.flagship.account_ledger.ledger.LedgerIds;
import com.flagship.account_ledger.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Reads user-facing balances.
 *
 * Degraded mode: if the ledger cannot be read, the balance is reported as 0 and a warning is
 * logged. Nothing is mutated on this path, so no money is lost; display must not block on
 * ledger availability.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BalanceService {

    private final IdentityDirectory identityDirectory;
    private final LedgerGateway ledgerGateway;
    private final LedgerMetrics ledgerMetrics;

    /**
     * @return credits_posted - debits_posted, or 0 for an identity without a ledger account
     * @throws com.flagship.account_ledger.identity.IdentityNotFoundException if the identity is unknown
     */
    public long balance(UUID identityId) {
        return summary(identityId).getBalance();
    }

    /**
     * Reads the identity and its balance in one call.
     */
    public IdentityBalance summary(UUID identityId) {
        return summary(identityDirectory.getIdentity(identityId));
    }

    public IdentityBalance summary(Identity identity) {
        if (!identity.isLinked()) {
            return new IdentityBalance(identity, 0, false);
        }

        long accountId = identity.getLedgerAccountId();
        try {
            return new IdentityBalance(identity, ledgerGateway.getPostedTotals(accountId).balance(), false);
        } catch (LedgerException e) {
            ledgerMetrics.recordDegradedBalanceRead();
            log.warn("Balance read for identity {} (account {}) failed, reporting 0: {}",
                    identity.getId(), LedgerIds.format(accountId), e.getMessage());
            return new IdentityBalance(identity, 0, true);
        }
    }
}

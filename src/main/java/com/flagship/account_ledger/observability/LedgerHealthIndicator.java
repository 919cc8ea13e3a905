package com.flagship.account_ledger.observability;

import com.flagship.account_ledger.ledger.LedgerException;
import com.flagship.account_ledger.ledger.LedgerGateway;
import com.flagship.account_ledger.ledger.LedgerIds;
import com.flagship.account_ledger.ledger.MasterAccountBootstrap;
import com.flagship.account_ledger.ledger.PostedTotals;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Ready only if both clearing accounts can be read from the ledger engine.
 */
@Component("ledgerHealth")
public class LedgerHealthIndicator implements HealthIndicator {

    private final LedgerGateway ledgerGateway;
    private final MasterAccountBootstrap bootstrap;

    public LedgerHealthIndicator(LedgerGateway ledgerGateway, MasterAccountBootstrap bootstrap) {
        this.ledgerGateway = ledgerGateway;
        this.bootstrap = bootstrap;
    }

    @Override
    public Health health() {
        try {
            PostedTotals debitSink = ledgerGateway.getPostedTotals(LedgerIds.MASTER_DEBIT_ACCOUNT_ID);
            PostedTotals creditSource = ledgerGateway.getPostedTotals(LedgerIds.MASTER_CREDIT_ACCOUNT_ID);

            return Health.up()
                    .withDetail("masterDebitCredits", debitSink.getCreditsPosted())
                    .withDetail("masterCreditDebits", creditSource.getDebitsPosted())
                    .withDetail("bootstrapUnresolved", bootstrap.getUnresolvedAccounts())
                    .build();
        } catch (LedgerException e) {
            return Health.down()
                    .withDetail("error", e.getMessage())
                    .withDetail("bootstrapUnresolved", bootstrap.getUnresolvedAccounts())
                    .build();
        }
    }
}

package com.flagship.account_ledger.ledger;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Ledger engine backed by PostgreSQL.
 *
 * Accounts live in {@code ledger_accounts}, transfers in {@code ledger_transfers}. The schema
 * makes transfers immutable and posted counters non-decreasing (see V2 migration).
 *
 * A transfer is applied in one database transaction:
 * 1. Lock both accounts, lowest id first, so concurrent transfers cannot deadlock
 * 2. Reject a transfer id that was already accepted
 * 3. Enforce DEBITS_MUST_NOT_EXCEED_CREDITS on the debit side
 * 4. Insert the transfer and bump both counters
 *
 * Because the sufficiency check and the counter update happen under the same row lock, two
 * concurrent debits can never drive a flagged account negative.
 */
@Service
@Slf4j
public class JdbcLedgerGateway implements LedgerGateway {

    private static final String ACCOUNT_COLUMNS =
        "id, ledger, code, flags, debits_posted, credits_posted";

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final int ledger;

    public JdbcLedgerGateway(JdbcTemplate jdbcTemplate,
                             TransactionTemplate transactionTemplate,
                             @Value("${ledger.partition:1}") int ledger) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = transactionTemplate;
        this.ledger = ledger;
    }

    @Override
    public LedgerAccount createAccount(long accountId, AccountCategory category) {
        if (accountId == 0) {
            throw new IllegalArgumentException("Account id must not be zero");
        }
        if (LedgerIds.isMasterAccount(accountId) != (category != AccountCategory.USER)) {
            throw new IllegalArgumentException(String.format(
                "Account id %s is not valid for category %s", LedgerIds.format(accountId), category));
        }
        int flags = category == AccountCategory.USER ? LedgerAccount.DEBITS_MUST_NOT_EXCEED_CREDITS : 0;

        return call("createAccount", () -> {
            try {
                jdbcTemplate.update(
                    "INSERT INTO ledger_accounts (id, ledger, code, flags, debits_posted, credits_posted, created_at) " +
                    "VALUES (?, ?, ?, ?, 0, 0, CURRENT_TIMESTAMP)",
                    accountId, ledger, category.getCode(), flags
                );
            } catch (DuplicateKeyException e) {
                throw new AccountExistsException(accountId);
            }
            log.debug("Created ledger account {} ({})", LedgerIds.format(accountId), category);
            return new LedgerAccount(accountId, ledger, category, flags, 0, 0);
        });
    }

    @Override
    public LedgerAccount getAccount(long accountId) {
        return call("getAccount", () -> jdbcTemplate.query(
                "SELECT " + ACCOUNT_COLUMNS + " FROM ledger_accounts WHERE id = ?",
                accountRowMapper(),
                accountId
            ).stream()
            .findFirst()
            .orElseThrow(() -> new LedgerAccountNotFoundException(accountId)));
    }

    @Override
    public PostedTotals getPostedTotals(long accountId) {
        return getAccount(accountId).postedTotals();
    }

    @Override
    public void createTransfer(long transferId, long debitAccountId, long creditAccountId, long amount) {
        if (amount <= 0) {
            throw new TransferRejectedException(transferId, TransferRejectedException.Reason.AMOUNT_MUST_BE_POSITIVE);
        }
        if (debitAccountId == creditAccountId) {
            throw new TransferRejectedException(transferId, TransferRejectedException.Reason.ACCOUNTS_MUST_BE_DIFFERENT);
        }

        call("createTransfer", () -> {
            try {
                return transactionTemplate.execute(
                    status -> applyTransfer(transferId, debitAccountId, creditAccountId, amount));
            } catch (DataIntegrityViolationException e) {
                // Transaction rolled back, nothing applied
                log.warn("Ledger transfer {} violated a storage constraint: {}",
                        LedgerIds.format(transferId), e.getMessage());
                throw new TransferRejectedException(transferId, TransferRejectedException.Reason.CONSTRAINT_VIOLATED);
            }
        });

        log.debug("Posted transfer {}: {} from {} to {}",
                LedgerIds.format(transferId), amount,
                LedgerIds.format(debitAccountId), LedgerIds.format(creditAccountId));
    }

    private Void applyTransfer(long transferId, long debitAccountId, long creditAccountId, long amount) {
        List<LedgerAccount> locked = jdbcTemplate.query(
            "SELECT " + ACCOUNT_COLUMNS + " FROM ledger_accounts WHERE id IN (?, ?) ORDER BY id FOR UPDATE",
            accountRowMapper(),
            debitAccountId,
            creditAccountId
        );

        if (findTransferRow(transferId).isPresent()) {
            throw new TransferExistsException(transferId);
        }

        LedgerAccount debitAccount = find(locked, debitAccountId);
        find(locked, creditAccountId);

        if (debitAccount.hasFlag(LedgerAccount.DEBITS_MUST_NOT_EXCEED_CREDITS)
                && !debitAccount.postedTotals().covers(amount)) {
            throw new TransferRejectedException(transferId, TransferRejectedException.Reason.EXCEEDS_CREDITS);
        }

        try {
            jdbcTemplate.update(
                "INSERT INTO ledger_transfers (id, debit_account_id, credit_account_id, amount, ledger, code, created_at) " +
                "VALUES (?, ?, ?, ?, ?, ?, CURRENT_TIMESTAMP)",
                transferId, debitAccountId, creditAccountId, amount, ledger, LedgerTransfer.STANDARD_CODE
            );
        } catch (DuplicateKeyException e) {
            // Same id committed by a transfer on other accounts after our lookup
            throw new TransferExistsException(transferId);
        }

        jdbcTemplate.update(
            "UPDATE ledger_accounts SET debits_posted = debits_posted + ? WHERE id = ?",
            amount, debitAccountId
        );
        jdbcTemplate.update(
            "UPDATE ledger_accounts SET credits_posted = credits_posted + ? WHERE id = ?",
            amount, creditAccountId
        );
        return null;
    }

    @Override
    public Optional<LedgerTransfer> findTransfer(long transferId) {
        return call("findTransfer", () -> findTransferRow(transferId));
    }

    private Optional<LedgerTransfer> findTransferRow(long transferId) {
        return jdbcTemplate.query(
                "SELECT id, debit_account_id, credit_account_id, amount, ledger, code, created_at " +
                "FROM ledger_transfers WHERE id = ?",
                transferRowMapper(),
                transferId
            ).stream()
            .findFirst();
    }

    private static LedgerAccount find(List<LedgerAccount> accounts, long accountId) {
        return accounts.stream()
            .filter(account -> account.getId() == accountId)
            .findFirst()
            .orElseThrow(() -> new LedgerAccountNotFoundException(accountId));
    }

    /**
     * Runs an engine call, translating storage failures into {@link LedgerUnavailableException}.
     * {@link LedgerException}s raised by the call itself pass through unchanged.
     */
    private <T> T call(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException | TransactionException e) {
            log.warn("Ledger engine call {} failed: {}", operation, e.getMessage());
            throw new LedgerUnavailableException(operation, e);
        }
    }

    private RowMapper<LedgerAccount> accountRowMapper() {
        return (rs, rowNum) -> new LedgerAccount(
            rs.getLong("id"),
            rs.getInt("ledger"),
            AccountCategory.fromCode(rs.getInt("code")),
            rs.getInt("flags"),
            rs.getLong("debits_posted"),
            rs.getLong("credits_posted")
        );
    }

    private RowMapper<LedgerTransfer> transferRowMapper() {
        return (rs, rowNum) -> new LedgerTransfer(
            rs.getLong("id"),
            rs.getLong("debit_account_id"),
            rs.getLong("credit_account_id"),
            rs.getLong("amount"),
            rs.getInt("ledger"),
            rs.getInt("code"),
            rs.getTimestamp("created_at").toInstant()
        );
    }
}

package com.flagship.account_ledger.movement;

import com.flagship.account_ledger.error.AccountNotLinkedException;
import com.flagship.account_ledger.error.BankingException;
import com.flagship.account_ledger.error.DuplicateSubmissionException;
import com.flagship.account_ledger.error.EngineUnavailableException;
import com.flagship.account_ledger.error.InsufficientFundsException;
import com.flagship.account_ledger.error.InvalidAmountException;
import com.flagship.account_ledger.error.MovementRejectedException;
import com.flagship.account_ledger.error.SameAccountException;
import com.flagship.account_ledger.identity.Identity;
import com.flagship.account_ledger.identity.IdentityDirectory;
import com.flagship.account_ledger.ledger.LedgerAccountNotFoundException;
import com.flagship.account_ledger.ledger.LedgerException;
import com.flagship.account_ledger.ledger.LedgerGateway;
import com.flagship.account_ledger.ledger.LedgerIds;
import com.flagship.account_ledger.ledger.LedgerTransfer;
import com.flagship.account_ledger.ledger.LedgerUnavailableException;
import com.flagship.account_ledger.ledger.PostedTotals;
import com.flagship.account_ledger.ledger.TransferExistsException;
import com.flagship.account_ledger.ledger.TransferRejectedException;
import com.flagship.account_ledger.observability.CorrelationContext;
import com.flagship.account_ledger.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * Deposits, withdrawals and transfers as ledger transfer submissions.
 *
 * Postings:
 * - deposit:    debit master credit (2), credit user
 * - withdrawal: debit user, credit master debit (1)
 * - transfer:   debit source user, credit destination user
 *
 * Debits are preceded by a sufficiency check on posted totals. The check and the submission
 * are separate engine calls; the engine itself rejects any transfer that would push a user
 * account's debits above its credits, so the check only saves a round trip and produces a
 * readable error. A lost race surfaces as {@link InsufficientFundsException} too. When the
 * check fails, the transfer id is looked up first: a retry of a debit that was already
 * applied gets {@link DuplicateSubmissionException}.
 *
 * Idempotency rests on transfer id uniqueness in the engine. This service keeps no log of
 * submitted operations; a repeated id surfaces as {@link DuplicateSubmissionException}. Callers
 * that retry after a timeout must pass the same transfer id to the overloads that take one.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MoneyMovementService {

    private final IdentityDirectory identityDirectory;
    private final LedgerGateway ledgerGateway;
    private final LedgerMetrics ledgerMetrics;

    public MovementReceipt deposit(UUID identityId, long amount) {
        return deposit(identityId, amount, LedgerIds.newTransferId());
    }

    public MovementReceipt deposit(UUID identityId, long amount, long transferId) {
        return run(MovementType.DEPOSIT, identityId, transferId, () -> {
            requirePositive(amount);
            long accountId = linkedAccount(identityId);
            return submit(MovementType.DEPOSIT, transferId, LedgerIds.MASTER_CREDIT_ACCOUNT_ID, accountId, amount);
        });
    }

    public MovementReceipt withdraw(UUID identityId, long amount) {
        return withdraw(identityId, amount, LedgerIds.newTransferId());
    }

    public MovementReceipt withdraw(UUID identityId, long amount, long transferId) {
        return run(MovementType.WITHDRAWAL, identityId, transferId, () -> {
            requirePositive(amount);
            long accountId = linkedAccount(identityId);
            ensureSufficientFunds(transferId, accountId, LedgerIds.MASTER_DEBIT_ACCOUNT_ID, amount);
            return submit(MovementType.WITHDRAWAL, transferId, accountId, LedgerIds.MASTER_DEBIT_ACCOUNT_ID, amount);
        });
    }

    public MovementReceipt transfer(UUID fromIdentityId, UUID toIdentityId, long amount) {
        return transfer(fromIdentityId, toIdentityId, amount, LedgerIds.newTransferId());
    }

    public MovementReceipt transfer(UUID fromIdentityId, UUID toIdentityId, long amount, long transferId) {
        return run(MovementType.TRANSFER, fromIdentityId, transferId, () -> {
            requirePositive(amount);
            if (fromIdentityId != null && fromIdentityId.equals(toIdentityId)) {
                throw new SameAccountException();
            }
            long sourceAccountId = linkedAccount(fromIdentityId);
            long destinationAccountId = linkedAccount(toIdentityId);
            if (sourceAccountId == destinationAccountId) {
                throw new SameAccountException();
            }
            ensureSufficientFunds(transferId, sourceAccountId, destinationAccountId, amount);
            return submit(MovementType.TRANSFER, transferId, sourceAccountId, destinationAccountId, amount);
        });
    }

    private MovementReceipt run(MovementType type, UUID identityId, long transferId, Movement movement) {
        long startTime = System.currentTimeMillis();
        String operation = type.name().toLowerCase(Locale.ROOT);
        MDC.put(CorrelationContext.IDENTITY_ID_MDC_KEY, String.valueOf(identityId));
        MDC.put(CorrelationContext.TRANSFER_ID_MDC_KEY, LedgerIds.format(transferId));

        try {
            MovementReceipt receipt = movement.execute();

            long duration = System.currentTimeMillis() - startTime;
            ledgerMetrics.recordMovement(operation, "success");
            ledgerMetrics.recordLatency(operation, duration);
            log.info("{} completed: amount={}, debit={}, credit={}, duration={}ms",
                    type, receipt.getAmount(),
                    LedgerIds.format(receipt.getDebitAccountId()),
                    LedgerIds.format(receipt.getCreditAccountId()),
                    duration);
            return receipt;
        } catch (BankingException e) {
            long duration = System.currentTimeMillis() - startTime;
            ledgerMetrics.recordMovement(operation, e.getKind().name().toLowerCase(Locale.ROOT));
            ledgerMetrics.recordLatency(operation, duration);
            log.warn("{} failed: kind={}, error={}, duration={}ms", type, e.getKind(), e.getMessage(), duration);
            throw e;
        } finally {
            MDC.remove(CorrelationContext.IDENTITY_ID_MDC_KEY);
            MDC.remove(CorrelationContext.TRANSFER_ID_MDC_KEY);
        }
    }

    private static void requirePositive(long amount) {
        if (amount <= 0) {
            throw new InvalidAmountException(amount);
        }
    }

    private long linkedAccount(UUID identityId) {
        if (identityId == null) {
            throw new IllegalArgumentException("Identity id is required");
        }
        Identity identity = identityDirectory.getIdentity(identityId);
        return identity.ledgerAccount()
            .orElseThrow(() -> new AccountNotLinkedException(identityId));
    }

    private void ensureSufficientFunds(long transferId, long accountId, long creditAccountId, long amount) {
        PostedTotals totals;
        try {
            totals = ledgerGateway.getPostedTotals(accountId);
        } catch (LedgerUnavailableException e) {
            throw new EngineUnavailableException("balance check", e);
        } catch (LedgerAccountNotFoundException e) {
            throw new MovementRejectedException(
                "Linked ledger account " + LedgerIds.format(accountId) + " does not exist", e);
        }

        if (!totals.covers(amount)) {
            rejectIfAlreadySubmitted(transferId, accountId, creditAccountId, amount);
            throw new InsufficientFundsException(accountId, totals.balance(), amount);
        }
    }

    /**
     * A retry of a debit that already went through usually fails the funds check, because the
     * first attempt spent the money. Report it as a duplicate so the caller knows it was applied.
     */
    private void rejectIfAlreadySubmitted(long transferId, long debitAccountId, long creditAccountId, long amount) {
        Optional<LedgerTransfer> existing;
        try {
            existing = ledgerGateway.findTransfer(transferId);
        } catch (LedgerException e) {
            throw new EngineUnavailableException("duplicate check", e);
        }
        if (existing.isPresent()) {
            throw new DuplicateSubmissionException(transferId,
                    existing.get().sameMovement(debitAccountId, creditAccountId, amount), null);
        }
    }

    private MovementReceipt submit(MovementType type, long transferId,
                                   long debitAccountId, long creditAccountId, long amount) {
        try {
            ledgerGateway.createTransfer(transferId, debitAccountId, creditAccountId, amount);
        } catch (TransferExistsException e) {
            throw new DuplicateSubmissionException(transferId,
                    matchesOriginal(transferId, debitAccountId, creditAccountId, amount), e);
        } catch (TransferRejectedException e) {
            if (e.getReason() == TransferRejectedException.Reason.EXCEEDS_CREDITS) {
                throw new InsufficientFundsException(debitAccountId, amount, e);
            }
            throw new MovementRejectedException(e.getMessage(), e);
        } catch (LedgerAccountNotFoundException e) {
            throw new MovementRejectedException(e.getMessage(), e);
        } catch (LedgerUnavailableException e) {
            throw new EngineUnavailableException("transfer submission", e);
        }
        return new MovementReceipt(transferId, type, debitAccountId, creditAccountId, amount);
    }

    /**
     * Whether the transfer already stored under this id moves the same amount between the
     * same accounts, i.e. this submission is a retry of an applied operation.
     */
    private boolean matchesOriginal(long transferId, long debitAccountId, long creditAccountId, long amount) {
        try {
            return ledgerGateway.findTransfer(transferId)
                .map(original -> original.sameMovement(debitAccountId, creditAccountId, amount))
                .orElse(false);
        } catch (LedgerException e) {
            log.warn("Could not load existing transfer {}: {}", LedgerIds.format(transferId), e.getMessage());
            return false;
        }
    }

    @FunctionalInterface
    private interface Movement {
        MovementReceipt execute();
    }
}

package com.flagship.account_ledger.api;

import com.flagship.account_ledger.account.AccountProvisioner;
import com.flagship.account_ledger.api.dto.AccountResponse;
import com.flagship.account_ledger.api.dto.AmountRequest;
import com.flagship.account_ledger.api.dto.BalanceResponse;
import com.flagship.account_ledger.api.dto.IdentityResponse;
import com.flagship.account_ledger.api.dto.IdentitySummaryResponse;
import com.flagship.account_ledger.api.dto.MovementResponse;
import com.flagship.account_ledger.api.dto.RegisterIdentityRequest;
import com.flagship.account_ledger.api.dto.TransferRequest;
import com.flagship.account_ledger.identity.Identity;
import com.flagship.account_ledger.identity.IdentityDirectory;
import com.flagship.account_ledger.identity.IdentityNotFoundException;
import com.flagship.account_ledger.identity.IdentityRegistration;
import com.flagship.account_ledger.ledger.LedgerIds;
import com.flagship.account_ledger.movement.BalanceService;
import com.flagship.account_ledger.movement.MoneyMovementService;
import com.flagship.account_ledger.movement.MovementReceipt;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * REST surface over provisioning, money movement and balance reads.
 *
 * Money movement endpoints accept an optional Idempotency-Key header. The transfer id is
 * derived from the key, so a retried request is either applied once or answered with
 * 409 DUPLICATE_SUBMISSION (matching_original=true when it is the same movement).
 * Without the header every request gets a fresh transfer id.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class BankingController {

    private static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private final AccountProvisioner accountProvisioner;
    private final IdentityDirectory identityDirectory;
    private final MoneyMovementService moneyMovementService;
    private final BalanceService balanceService;

    @PostMapping("/identities")
    public ResponseEntity<IdentityResponse> register(@Valid @RequestBody RegisterIdentityRequest request) {
        log.info("Received registration request");
        Identity identity = accountProvisioner.registerWithAccount(
            new IdentityRegistration(request.getEmail(), request.getPassword(), request.getFullName()));
        return ResponseEntity.status(HttpStatus.CREATED).body(IdentityResponse.from(identity));
    }

    @GetMapping("/identities")
    public ResponseEntity<List<IdentityResponse>> listIdentities(
            @RequestParam(value = "limit", defaultValue = "20") int limit,
            @RequestParam(value = "offset", defaultValue = "0") int offset) {
        List<IdentityResponse> identities = identityDirectory.listIdentities(limit, offset).stream()
            .map(IdentityResponse::from)
            .toList();
        return ResponseEntity.ok(identities);
    }

    @GetMapping("/identities/{id}")
    public ResponseEntity<IdentityResponse> getIdentity(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(IdentityResponse.from(identityDirectory.getIdentity(id)));
    }

    /**
     * Creates and links a ledger account for an identity that has none.
     */
    @PostMapping("/identities/{id}/account")
    public ResponseEntity<IdentityResponse> associate(@PathVariable("id") UUID id) {
        accountProvisioner.associate(id);
        return ResponseEntity.ok(IdentityResponse.from(identityDirectory.getIdentity(id)));
    }

    @GetMapping("/identities/{id}/balance")
    public ResponseEntity<BalanceResponse> balance(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(new BalanceResponse(id, balanceService.balance(id)));
    }

    @GetMapping("/identities/{id}/summary")
    public ResponseEntity<IdentitySummaryResponse> summary(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(IdentitySummaryResponse.from(balanceService.summary(id)));
    }

    @GetMapping("/identities/{id}/accounts")
    public ResponseEntity<List<AccountResponse>> accounts(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(AccountResponse.listOf(balanceService.summary(id)));
    }

    /**
     * Looks up a ledger account by its unsigned decimal id and reports its owner and balance.
     */
    @GetMapping("/accounts/{accountId}")
    public ResponseEntity<AccountResponse> account(@PathVariable("accountId") String accountId) {
        long id = LedgerIds.parse(accountId);
        Identity owner = identityDirectory.findByLedgerAccountId(id)
            .orElseThrow(() -> IdentityNotFoundException.forLedgerAccount(id));
        return ResponseEntity.ok(AccountResponse.listOf(balanceService.summary(owner)).get(0));
    }

    @PostMapping("/identities/{id}/deposits")
    public ResponseEntity<MovementResponse> deposit(
            @PathVariable("id") UUID id,
            @Valid @RequestBody AmountRequest request,
            @RequestHeader(value = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey) {

        MovementReceipt receipt = moneyMovementService.deposit(id, request.getAmount(), transferId(idempotencyKey));
        return ResponseEntity.status(HttpStatus.CREATED).body(MovementResponse.from(receipt));
    }

    @PostMapping("/identities/{id}/withdrawals")
    public ResponseEntity<MovementResponse> withdraw(
            @PathVariable("id") UUID id,
            @Valid @RequestBody AmountRequest request,
            @RequestHeader(value = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey) {

        MovementReceipt receipt = moneyMovementService.withdraw(id, request.getAmount(), transferId(idempotencyKey));
        return ResponseEntity.status(HttpStatus.CREATED).body(MovementResponse.from(receipt));
    }

    @PostMapping("/transfers")
    public ResponseEntity<MovementResponse> transfer(
            @Valid @RequestBody TransferRequest request,
            @RequestHeader(value = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey) {

        MovementReceipt receipt = moneyMovementService.transfer(
            request.getFromIdentityId(), request.getToIdentityId(), request.getAmount(), transferId(idempotencyKey));
        return ResponseEntity.status(HttpStatus.CREATED).body(MovementResponse.from(receipt));
    }

    private static long transferId(String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            return LedgerIds.newTransferId();
        }
        return LedgerIds.transferIdFor(idempotencyKey);
    }
}

package com.flagship.account_ledger.identity;

import com.flagship.account_ledger.ledger.LedgerIds;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * Identity directory backed by the {@code identities} table.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JpaIdentityDirectory implements IdentityDirectory {

    private final IdentityRepository identityRepository;
    private final PasswordEncoder passwordEncoder;

    @Override
    @Transactional
    public Identity createIdentity(IdentityRegistration registration) {
        if (registration == null) {
            throw new IllegalArgumentException("Registration cannot be null");
        }
        String email = normalizeEmail(registration.getEmail());
        if (registration.getPassword() == null || registration.getPassword().isBlank()) {
            throw new IllegalArgumentException("Password is required");
        }
        if (registration.getFullName() == null || registration.getFullName().isBlank()) {
            throw new IllegalArgumentException("Full name is required");
        }
        if (identityRepository.existsByEmail(email)) {
            throw new IllegalStateException("Email already registered: " + email);
        }

        IdentityEntity entity = IdentityEntity.register(
            UUID.randomUUID(),
            email,
            passwordEncoder.encode(registration.getPassword()),
            registration.getFullName().trim()
        );
        IdentityEntity saved = identityRepository.save(entity);
        log.debug("Created identity {}", saved.getId());
        return saved.toDomain();
    }

    @Override
    @Transactional(readOnly = true)
    public Identity getIdentity(UUID identityId) {
        return identityRepository.findById(identityId)
            .map(IdentityEntity::toDomain)
            .orElseThrow(() -> new IdentityNotFoundException(identityId));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Identity> findByLedgerAccountId(long accountId) {
        return identityRepository.findByLedgerAccountId(accountId)
            .map(IdentityEntity::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Identity> listIdentities(int limit, int offset) {
        if (limit < 1 || limit > MAX_PAGE_SIZE) {
            throw new IllegalArgumentException("Limit must be between 1 and " + MAX_PAGE_SIZE + ", got " + limit);
        }
        if (offset < 0) {
            throw new IllegalArgumentException("Offset must not be negative, got " + offset);
        }
        return identityRepository.findPage(limit, offset).stream()
            .map(IdentityEntity::toDomain)
            .toList();
    }

    @Override
    @Transactional
    public void setLedgerLink(UUID identityId, long accountId) {
        int updated = identityRepository.linkLedgerAccount(identityId, accountId, Instant.now());
        if (updated == 1) {
            log.debug("Linked identity {} to ledger account {}", identityId, LedgerIds.format(accountId));
            return;
        }

        Identity existing = getIdentity(identityId);
        if (existing.getLedgerAccountId() == null) {
            throw new IllegalStateException("Ledger link for identity " + identityId + " was not written");
        }
        if (existing.getLedgerAccountId() == accountId) {
            log.debug("Identity {} already linked to ledger account {}", identityId, LedgerIds.format(accountId));
            return;
        }
        throw new IllegalStateException(String.format(
            "Identity %s is already linked to ledger account %s",
            identityId, LedgerIds.format(existing.getLedgerAccountId())));
    }

    @Override
    @Transactional
    public void deleteIdentity(UUID identityId) {
        if (!identityRepository.existsById(identityId)) {
            throw new IdentityNotFoundException(identityId);
        }
        identityRepository.deleteById(identityId);
        log.debug("Deleted identity {}", identityId);
    }

    private static String normalizeEmail(String email) {
        if (email == null || email.isBlank()) {
            throw new IllegalArgumentException("Email is required");
        }
        return email.trim().toLowerCase(Locale.ROOT);
    }
}

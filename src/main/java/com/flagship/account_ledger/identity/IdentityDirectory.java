package com.flagship.account_ledger.identity;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Store of identity records. Owns the ledger link field; only the account provisioner
 * writes it.
 */
public interface IdentityDirectory {

    int MAX_PAGE_SIZE = 100;

    Identity createIdentity(IdentityRegistration registration);

    /**
     * @throws IdentityNotFoundException if the identity does not exist
     */
    Identity getIdentity(UUID identityId);

    Optional<Identity> findByLedgerAccountId(long accountId);

    /**
     * Newest identities first.
     *
     * @throws IllegalArgumentException if limit is outside 1..{@value #MAX_PAGE_SIZE} or offset is negative
     */
    List<Identity> listIdentities(int limit, int offset);

    /**
     * Links a ledger account to an identity. Re-linking the same account is a no-op; linking
     * a different one fails, because the link is immutable.
     *
     * @throws IdentityNotFoundException if the identity does not exist
     * @throws IllegalStateException if the identity is linked to another account
     */
    void setLedgerLink(UUID identityId, long accountId);

    /**
     * @throws IdentityNotFoundException if the identity does not exist
     */
    void deleteIdentity(UUID identityId);
}

package com.flagship.account_ledger.identity;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface IdentityRepository extends JpaRepository<IdentityEntity, UUID> {

    boolean existsByEmail(String email);

    Optional<IdentityEntity> findByLedgerAccountId(Long ledgerAccountId);

    /**
     * Newest first. Offset need not be a multiple of the limit, so this is not a {@code Pageable}.
     */
    @Query(value = """
        SELECT * FROM identities
        ORDER BY created_at DESC, id
        LIMIT :limit OFFSET :offset
        """, nativeQuery = true)
    List<IdentityEntity> findPage(@Param("limit") int limit, @Param("offset") int offset);

    /**
     * Writes the ledger link only if none is set yet.
     *
     * @return 1 if the link was written, 0 if the identity is missing or already linked
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE IdentityEntity i SET i.ledgerAccountId = :accountId, i.updatedAt = :now " +
           "WHERE i.id = :id AND i.ledgerAccountId IS NULL")
    int linkLedgerAccount(@Param("id") UUID identityId,
                          @Param("accountId") Long accountId,
                          @Param("now") Instant now);
}

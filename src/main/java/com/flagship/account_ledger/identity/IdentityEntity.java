package com.flagship.account_ledger.identity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for the {@code identities} table.
 *
 * No setters: the only mutable field is the ledger link, and it is written through
 * {@link IdentityRepository#linkLedgerAccount} so the "set once" rule is checked in SQL.
 * A database trigger rejects any other change to a non-null link.
 */
@Entity
@Table(
    name = "identities",
    indexes = {
        @Index(name = "idx_identities_email", columnList = "email"),
        @Index(name = "idx_identities_ledger_account_id", columnList = "ledger_account_id")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class IdentityEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(nullable = false, unique = true)
    private String email;

    @Column(name = "credential_hash", nullable = false)
    private String credentialHash;

    @Column(name = "full_name", nullable = false)
    private String fullName;

    @Column(name = "ledger_account_id", unique = true)
    private Long ledgerAccountId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static IdentityEntity register(UUID id, String email, String credentialHash, String fullName) {
        return new IdentityEntity(
            id,
            email,
            credentialHash,
            fullName,
            null, // linked later by the provisioner
            null,
            null
        );
    }

    public Identity toDomain() {
        return new Identity(id, email, fullName, ledgerAccountId, createdAt, updatedAt);
    }
}

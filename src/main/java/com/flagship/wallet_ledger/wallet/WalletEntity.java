package com.flagship.wallet_ledger.wallet;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * JPA Entity for Wallet persistence.
 *
 * Key design principles:
 * - No @Setter: the only way to change state is {@link #updateFromDomain(Wallet)}
 * - Immutable columns (id, created_at) are updatable = false
 * - Timestamps come from the domain object so that a wallet and its cascaded
 *   transactions can share the exact same deactivated_at value
 */
@Entity
@Table(
    name = "wallets",
    indexes = {
        @Index(name = "idx_wallets_is_active", columnList = "is_active")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class WalletEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(nullable = false, length = 255)
    private String label;

    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal balance;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    @Column(name = "deactivated_at")
    private Instant deactivatedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
        if (this.updatedAt == null) {
            this.updatedAt = this.createdAt;
        }
    }

    static WalletEntity fromDomain(Wallet wallet) {
        return new WalletEntity(
            wallet.getId(),
            wallet.getLabel(),
            wallet.getBalance(),
            wallet.isActive(),
            wallet.getDeactivatedAt(),
            wallet.getCreatedAt(),
            wallet.getUpdatedAt()
        );
    }

    public Wallet toDomain() {
        return new Wallet(
            id,
            label,
            balance,
            active,
            deactivatedAt,
            createdAt,
            updatedAt
        );
    }

    /**
     * Copies the mutable fields from the domain object.
     * id and createdAt never change.
     */
    void updateFromDomain(Wallet wallet) {
        if (!this.id.equals(wallet.getId())) {
            throw new IllegalArgumentException(
                "Cannot update wallet " + this.id + " from wallet " + wallet.getId());
        }
        if (!this.active && wallet.isActive()) {
            throw new IllegalStateException("Wallet " + this.id + " cannot be reactivated");
        }
        this.label = wallet.getLabel();
        this.balance = wallet.getBalance();
        this.active = wallet.isActive();
        this.deactivatedAt = wallet.getDeactivatedAt();
        this.updatedAt = wallet.getUpdatedAt();
    }
}

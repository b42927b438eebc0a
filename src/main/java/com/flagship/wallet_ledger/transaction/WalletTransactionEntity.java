package com.flagship.wallet_ledger.transaction;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * JPA Entity for wallet transaction persistence.
 *
 * The txid uniqueness is enforced by the database (uk_wallet_transactions_txid),
 * never by a read before the insert. Rows are only changed afterwards by the
 * bulk cascade query in {@link WalletTransactionRepository}.
 */
@Entity
@Table(
    name = "wallet_transactions",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_wallet_transactions_txid", columnNames = "txid")
    },
    indexes = {
        @Index(name = "idx_wallet_transactions_wallet", columnList = "wallet_id, created_at, sequence_number")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class WalletTransactionEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "wallet_id", nullable = false, updatable = false)
    private UUID walletId;

    @Column(nullable = false, updatable = false, length = 255)
    private String txid;

    @Column(nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal amount;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    @Column(name = "deactivated_at")
    private Instant deactivatedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    // Assigned by the database, breaks ties between equal created_at values
    @Column(name = "sequence_number", insertable = false, updatable = false)
    private Long sequenceNumber;

    @PrePersist
    void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
        if (this.updatedAt == null) {
            this.updatedAt = this.createdAt;
        }
    }

    static WalletTransactionEntity fromDomain(WalletTransaction transaction) {
        WalletTransactionEntity entity = new WalletTransactionEntity();
        entity.id = transaction.getId();
        entity.walletId = transaction.getWalletId();
        entity.txid = transaction.getTxid();
        entity.amount = transaction.getAmount();
        entity.active = transaction.isActive();
        entity.deactivatedAt = transaction.getDeactivatedAt();
        entity.createdAt = transaction.getCreatedAt();
        entity.updatedAt = transaction.getUpdatedAt();
        return entity;
    }

    public WalletTransaction toDomain() {
        return new WalletTransaction(
            id,
            walletId,
            txid,
            amount,
            active,
            deactivatedAt,
            createdAt,
            updatedAt
        );
    }
}

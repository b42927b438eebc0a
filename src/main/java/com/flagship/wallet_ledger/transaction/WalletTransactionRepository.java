package com.flagship.wallet_ledger.transaction;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface WalletTransactionRepository extends JpaRepository<WalletTransactionEntity, UUID> {

    Optional<WalletTransactionEntity> findByTxid(String txid);

    @Query("""
        SELECT t FROM WalletTransactionEntity t
        WHERE t.walletId IN :walletIds
        ORDER BY t.createdAt ASC, t.sequenceNumber ASC
        """)
    List<WalletTransactionEntity> findByWalletIds(@Param("walletIds") Collection<UUID> walletIds);

    /**
     * Flips every active transaction of a wallet to inactive in one statement.
     * The persistence context is flushed before and cleared after, so no stale
     * entity can overwrite the change.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE WalletTransactionEntity t
        SET t.active = false, t.deactivatedAt = :at, t.updatedAt = :at
        WHERE t.walletId = :walletId AND t.active = true
        """)
    int deactivateAllForWallet(@Param("walletId") UUID walletId, @Param("at") Instant at);
}

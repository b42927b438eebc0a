package com.flagship.wallet_ledger.wallet;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface WalletRepository extends JpaRepository<WalletEntity, UUID> {

    /**
     * Loads a wallet with SELECT ... FOR UPDATE.
     * The row stays locked until the surrounding transaction ends.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT w FROM WalletEntity w WHERE w.id = :id")
    Optional<WalletEntity> findByIdForUpdate(@Param("id") UUID id);

    List<WalletEntity> findAllByOrderByBalanceDescCreatedAtAsc();

    List<WalletEntity> findByActiveOrderByBalanceDescCreatedAtAsc(boolean active);

    List<WalletEntity> findByIdInOrderByBalanceDescCreatedAtAsc(Collection<UUID> ids);

    List<WalletEntity> findByActiveAndIdInOrderByBalanceDescCreatedAtAsc(boolean active, Collection<UUID> ids);
}

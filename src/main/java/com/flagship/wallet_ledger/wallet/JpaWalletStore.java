package com.flagship.wallet_ledger.wallet;

import com.flagship.wallet_ledger.ledger.exception.WalletNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * PostgreSQL-backed {@link WalletStore}.
 *
 * Bridges the domain layer (Wallet) and the persistence layer (WalletEntity).
 * Row locking is done with SELECT ... FOR UPDATE, bounded by a transaction-local
 * lock_timeout so a stuck holder cannot block a caller forever.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class JpaWalletStore implements WalletStore {

    private final WalletRepository walletRepository;
    private final JdbcTemplate jdbcTemplate;

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public Wallet insert(Wallet wallet) {
        WalletEntity saved = walletRepository.saveAndFlush(WalletEntity.fromDomain(wallet));
        log.debug("Inserted wallet {}", saved.getId());
        return saved.toDomain();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Wallet> findById(UUID walletId) {
        return walletRepository.findById(walletId)
            .map(WalletEntity::toDomain);
    }

    /**
     * Requires an open transaction: the row lock lives exactly as long as it.
     * SET LOCAL is reset by PostgreSQL at commit or rollback.
     */
    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public Wallet lockById(UUID walletId, Duration lockTimeout) {
        long timeoutMillis = Math.max(1L, lockTimeout.toMillis());
        jdbcTemplate.execute("SET LOCAL lock_timeout = " + timeoutMillis);
        return walletRepository.findByIdForUpdate(walletId)
            .map(WalletEntity::toDomain)
            .orElseThrow(() -> new WalletNotFoundException(walletId));
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public Wallet update(Wallet wallet) {
        WalletEntity existing = walletRepository.findById(wallet.getId())
            .orElseThrow(() -> new WalletNotFoundException(wallet.getId()));

        // Controlled update, no setters on the entity
        existing.updateFromDomain(wallet);

        WalletEntity updated = walletRepository.saveAndFlush(existing);
        log.debug("Updated wallet {} (active={}, balance={})",
            updated.getId(), updated.isActive(), updated.getBalance());
        return updated.toDomain();
    }

    @Override
    @Transactional(readOnly = true)
    public List<Wallet> findAll(WalletFilter filter) {
        if (filter.matchesNothing()) {
            return List.of();
        }

        List<WalletEntity> entities;
        if (filter.getActive() != null && filter.hasWalletIds()) {
            entities = walletRepository.findByActiveAndIdInOrderByBalanceDescCreatedAtAsc(
                filter.getActive(), filter.getWalletIds());
        } else if (filter.getActive() != null) {
            entities = walletRepository.findByActiveOrderByBalanceDescCreatedAtAsc(filter.getActive());
        } else if (filter.hasWalletIds()) {
            entities = walletRepository.findByIdInOrderByBalanceDescCreatedAtAsc(filter.getWalletIds());
        } else {
            entities = walletRepository.findAllByOrderByBalanceDescCreatedAtAsc();
        }

        return entities.stream()
            .map(WalletEntity::toDomain)
            .toList();
    }
}

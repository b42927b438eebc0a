package com.flagship.wallet_ledger.transaction;

import com.flagship.wallet_ledger.ledger.exception.DuplicateTransactionIdException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.hibernate.exception.ConstraintViolationException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * PostgreSQL-backed {@link TransactionStore}.
 *
 * Inserts are flushed immediately so the unique constraint on txid fires
 * inside {@link #insert(WalletTransaction)} and not at commit time.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class JpaTransactionStore implements TransactionStore {

    static final String TXID_CONSTRAINT = "uk_wallet_transactions_txid";

    private final WalletTransactionRepository repository;

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public WalletTransaction insert(WalletTransaction transaction) {
        try {
            WalletTransactionEntity saved = repository.saveAndFlush(
                WalletTransactionEntity.fromDomain(transaction));
            log.debug("Inserted transaction {} (txid={}) for wallet {}",
                saved.getId(), saved.getTxid(), saved.getWalletId());
            return saved.toDomain();
        } catch (DataIntegrityViolationException e) {
            if (isTxidViolation(e)) {
                throw new DuplicateTransactionIdException(transaction.getTxid(), e);
            }
            throw e;
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<WalletTransaction> findById(UUID transactionId) {
        return repository.findById(transactionId)
            .map(WalletTransactionEntity::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<WalletTransaction> findByTxid(String txid) {
        return repository.findByTxid(txid)
            .map(WalletTransactionEntity::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public List<WalletTransaction> findByWalletIds(Collection<UUID> walletIds) {
        if (walletIds.isEmpty()) {
            return List.of();
        }
        return repository.findByWalletIds(walletIds)
            .stream()
            .map(WalletTransactionEntity::toDomain)
            .toList();
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public int deactivateAllForWallet(UUID walletId, Instant at) {
        int updated = repository.deactivateAllForWallet(walletId, at);
        log.debug("Deactivated {} transactions of wallet {}", updated, walletId);
        return updated;
    }

    private static boolean isTxidViolation(DataIntegrityViolationException e) {
        Throwable cause = e;
        while (cause != null) {
            if (cause instanceof ConstraintViolationException violation
                    && violation.getConstraintName() != null
                    && violation.getConstraintName().contains(TXID_CONSTRAINT)) {
                return true;
            }
            if (cause.getMessage() != null && cause.getMessage().contains(TXID_CONSTRAINT)) {
                return true;
            }
            cause = cause.getCause() == cause ? null : cause.getCause();
        }
        return false;
    }
}

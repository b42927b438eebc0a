package com.flagship.wallet_ledger.transaction;

import com.flagship.wallet_ledger.ledger.exception.DuplicateTransactionIdException;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Keyed storage of wallet transactions.
 */
public interface TransactionStore {

    /**
     * Persists a new transaction. The txid check happens at write time.
     *
     * @throws DuplicateTransactionIdException if any transaction already uses this txid
     */
    WalletTransaction insert(WalletTransaction transaction);

    Optional<WalletTransaction> findById(UUID transactionId);

    Optional<WalletTransaction> findByTxid(String txid);

    /**
     * All transactions of the given wallets, active or not, oldest first.
     * Unknown wallet ids contribute nothing.
     */
    List<WalletTransaction> findByWalletIds(Collection<UUID> walletIds);

    /**
     * Marks every active transaction of the wallet inactive with {@code deactivatedAt = at}.
     *
     * @return number of transactions changed
     */
    int deactivateAllForWallet(UUID walletId, Instant at);
}

package com.flagship.wallet_ledger.wallet;

import com.flagship.wallet_ledger.ledger.exception.WalletNotFoundException;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Keyed storage of wallet records.
 *
 * Writes and {@link #lockById(UUID, Duration)} must run inside the caller's
 * database transaction; plain reads never block on writers.
 */
public interface WalletStore {

    Wallet insert(Wallet wallet);

    Optional<Wallet> findById(UUID walletId);

    /**
     * @throws WalletNotFoundException if no wallet has this id
     */
    default Wallet getById(UUID walletId) {
        return findById(walletId).orElseThrow(() -> new WalletNotFoundException(walletId));
    }

    /**
     * Reads a wallet and holds an exclusive row lock on it until the current
     * transaction ends. Waits at most {@code lockTimeout} for a competing holder.
     *
     * @throws WalletNotFoundException if no wallet has this id
     */
    Wallet lockById(UUID walletId, Duration lockTimeout);

    /**
     * Persists label, balance, active flag and timestamps of an existing wallet.
     *
     * @throws WalletNotFoundException if no wallet has this id
     */
    Wallet update(Wallet wallet);

    /**
     * Lists wallets ordered by balance (highest first), then creation time.
     */
    List<Wallet> findAll(WalletFilter filter);
}

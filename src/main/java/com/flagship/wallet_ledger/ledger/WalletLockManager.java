package com.flagship.wallet_ledger.ledger;

import com.flagship.wallet_ledger.ledger.exception.LockTimeoutException;

import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.function.Supplier;

/**
 * Mutual exclusion scoped to a single wallet id.
 *
 * Two actions for the same wallet never overlap; actions for different
 * wallets never wait on each other.
 */
public interface WalletLockManager {

    /**
     * Runs {@code action} while holding exclusive access to {@code walletId}.
     *
     * @param walletId wallet to lock
     * @param timeout  maximum time to wait for the lock
     * @param action   work to run once the lock is granted
     * @return whatever the action returns
     * @throws LockTimeoutException  if the lock was not granted within the timeout;
     *                               the action did not run
     * @throws CancellationException if the calling thread was interrupted while
     *                               waiting; the action did not run and the
     *                               interrupt flag is set again
     */
    <T> T executeLocked(UUID walletId, Duration timeout, Supplier<T> action);
}

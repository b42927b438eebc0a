package com.flagship.wallet_ledger.ledger;

import com.flagship.wallet_ledger.ledger.exception.LockTimeoutException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * In-process {@link WalletLockManager} backed by one fair {@link ReentrantLock} per wallet id.
 *
 * Entries are reference counted: a thread registers before it starts waiting and
 * unregisters after it releases (or gives up), and the entry is removed from the
 * map when the count drops to zero. The map therefore only holds wallets that are
 * currently locked or contended.
 *
 * Once the lock is granted the action runs to completion even if the thread is
 * interrupted meanwhile, so a commit is never cut in half. The interrupt is
 * re-asserted after the action returns.
 */
@Slf4j
public class LocalWalletLockManager implements WalletLockManager {

    private final ConcurrentMap<UUID, LockEntry> locks = new ConcurrentHashMap<>();

    @Override
    public <T> T executeLocked(UUID walletId, Duration timeout, Supplier<T> action) {
        LockEntry entry = acquireEntry(walletId);
        boolean granted = false;
        try {
            granted = entry.lock.tryLock(timeout.toNanos(), TimeUnit.NANOSECONDS);
            if (!granted) {
                log.warn("Lock wait for wallet {} timed out after {} ms", walletId, timeout.toMillis());
                throw new LockTimeoutException(walletId, timeout);
            }
            return runToCompletion(action);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Lock wait for wallet {} interrupted, abandoning operation", walletId);
            CancellationException cancellation =
                new CancellationException("Interrupted while waiting for wallet " + walletId);
            cancellation.initCause(e);
            throw cancellation;
        } finally {
            if (granted) {
                entry.lock.unlock();
            }
            releaseEntry(walletId, entry);
        }
    }

    /**
     * Number of wallet ids currently holding an entry (locked or waited on).
     */
    public int trackedLockCount() {
        return locks.size();
    }

    private static <T> T runToCompletion(Supplier<T> action) {
        // Interrupts raised from here on must not abort JDBC work mid-commit
        boolean interrupted = Thread.interrupted();
        try {
            return action.get();
        } finally {
            if (interrupted || Thread.interrupted()) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private LockEntry acquireEntry(UUID walletId) {
        return locks.compute(walletId, (id, existing) -> {
            LockEntry entry = existing != null ? existing : new LockEntry();
            entry.users++;
            return entry;
        });
    }

    private void releaseEntry(UUID walletId, LockEntry entry) {
        locks.computeIfPresent(walletId, (id, existing) -> {
            if (existing != entry) {
                return existing;
            }
            existing.users--;
            return existing.users == 0 ? null : existing;
        });
    }

    private static final class LockEntry {
        private final ReentrantLock lock = new ReentrantLock(true);
        // Guarded by the map's per-key compute
        private int users;
    }
}

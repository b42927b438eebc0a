package com.flagship.wallet_ledger.ledger;

import com.flagship.wallet_ledger.ledger.event.TransactionAppliedEvent;
import com.flagship.wallet_ledger.ledger.event.WalletCreatedEvent;
import com.flagship.wallet_ledger.ledger.event.WalletDeactivatedEvent;
import com.flagship.wallet_ledger.ledger.event.WalletLabelUpdatedEvent;
import com.flagship.wallet_ledger.ledger.exception.LedgerException;
import com.flagship.wallet_ledger.ledger.exception.LockTimeoutException;
import com.flagship.wallet_ledger.ledger.exception.TransactionNotFoundException;
import com.flagship.wallet_ledger.ledger.exception.WalletInactiveException;
import com.flagship.wallet_ledger.observability.CorrelationContext;
import com.flagship.wallet_ledger.observability.LedgerMetrics;
import com.flagship.wallet_ledger.outbox.OutboxService;
import com.flagship.wallet_ledger.transaction.TransactionStore;
import com.flagship.wallet_ledger.transaction.WalletTransaction;
import com.flagship.wallet_ledger.wallet.Wallet;
import com.flagship.wallet_ledger.wallet.WalletFilter;
import com.flagship.wallet_ledger.wallet.WalletStore;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionOperations;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.function.Function;

/**
 * The wallet ledger: applies transactions to balances, enforces txid uniqueness
 * and cascades wallet deactivation to transactions.
 *
 * Every mutation follows the same shape:
 * 1. Validate arguments (caller bugs fail fast with IllegalArgumentException)
 * 2. Acquire exclusive access to the wallet id ({@link WalletLockManager})
 * 3. Open a fresh database transaction and re-read the wallet under a row lock
 * 4. Check invariants, write wallet, transactions and outbox event
 * 5. Commit, then release the wallet lock
 *
 * Any exception thrown in step 4 rolls back the whole database transaction, so
 * a failure never leaves a partial write behind. Reads take no lock at all and
 * rely on PostgreSQL MVCC to only see committed state.
 */
@Service
@Slf4j
public class LedgerService {

    static final String AGGREGATE_TYPE = "Wallet";
    public static final int TXID_MAX_LENGTH = 255;
    public static final int AMOUNT_MAX_SCALE = 4;

    private final WalletStore walletStore;
    private final TransactionStore transactionStore;
    private final WalletLockManager lockManager;
    private final TransactionOperations transactionOperations;
    private final OutboxService outboxService;
    private final LedgerMetrics ledgerMetrics;
    private final LedgerProperties properties;
    private final Clock clock;

    public LedgerService(WalletStore walletStore,
                         TransactionStore transactionStore,
                         WalletLockManager lockManager,
                         TransactionOperations transactionOperations,
                         OutboxService outboxService,
                         LedgerMetrics ledgerMetrics,
                         LedgerProperties properties,
                         Clock clock) {
        this.walletStore = walletStore;
        this.transactionStore = transactionStore;
        this.lockManager = lockManager;
        this.transactionOperations = transactionOperations;
        this.outboxService = outboxService;
        this.ledgerMetrics = ledgerMetrics;
        this.properties = properties;
        this.clock = clock;
    }

    // ==================== Wallet lifecycle ====================

    /**
     * Opens a new active wallet with a zero balance.
     *
     * @throws com.flagship.wallet_ledger.ledger.exception.InvalidLabelException if the label is blank or too long
     */
    public Wallet createWallet(String label) {
        String normalized = Wallet.normalizeLabel(label, properties.getWallet().getLabelMaxLength());
        long start = System.nanoTime();

        Wallet created = transactionOperations.execute(status -> {
            Wallet wallet = walletStore.insert(Wallet.create(UUID.randomUUID(), normalized, now()));
            outboxService.saveEvent(AGGREGATE_TYPE, WalletCreatedEvent.fromWallet(wallet));
            return wallet;
        });

        ledgerMetrics.incrementWalletsCreated();
        ledgerMetrics.recordLatency("create_wallet", LedgerMetrics.RESULT_SUCCESS, elapsedSince(start));
        log.info("Wallet created: walletId={}, label={}", created.getId(), created.getLabel());
        return created;
    }

    // ==================== Core operations ====================

    public WalletTransaction applyTransaction(UUID walletId, String txid, BigDecimal amount) {
        return applyTransaction(walletId, txid, amount, defaultLockTimeout());
    }

    /**
     * Records a signed amount against a wallet and moves its balance by the same amount.
     *
     * The txid insert and the balance update commit together or not at all. The
     * txid check is the database unique constraint, so two callers racing with the
     * same txid on different wallets still cannot both succeed.
     *
     * @throws IllegalArgumentException if an argument is null, the txid is blank or
     *         longer than {@value #TXID_MAX_LENGTH} characters, or the amount is zero,
     *         has more than {@value #AMOUNT_MAX_SCALE} decimal places or more integer
     *         digits than a balance can hold
     * @throws com.flagship.wallet_ledger.ledger.exception.WalletNotFoundException if the wallet does not exist
     * @throws WalletInactiveException if the wallet has been deactivated
     * @throws com.flagship.wallet_ledger.ledger.exception.InsufficientBalanceException if a debit exceeds the balance
     * @throws com.flagship.wallet_ledger.ledger.exception.BalanceLimitExceededException if a credit overflows the balance
     * @throws com.flagship.wallet_ledger.ledger.exception.DuplicateTransactionIdException if the txid is already used
     * @throws LockTimeoutException if exclusive access (in-process and row lock
     *         together) was not obtained within {@code lockTimeout}
     * @throws CancellationException if the thread was interrupted while waiting
     */
    public WalletTransaction applyTransaction(UUID walletId, String txid, BigDecimal amount, Duration lockTimeout) {
        requireWalletId(walletId);
        validateTxid(txid);
        validateAmount(amount);
        requireTimeout(lockTimeout);

        long start = System.nanoTime();
        CorrelationContext.enterWalletScope(walletId, txid);
        try {
            WalletTransaction applied = runLocked(walletId, lockTimeout, rowLockBudget -> {
                Wallet wallet = walletStore.lockById(walletId, rowLockBudget);
                if (!wallet.isActive()) {
                    throw new WalletInactiveException(walletId);
                }

                Instant now = now();
                // Balance checks come before the insert so a rejected amount writes nothing
                Wallet credited = wallet.applyAmount(amount, now);
                WalletTransaction transaction = transactionStore.insert(
                    WalletTransaction.create(walletId, txid, amount, now));
                Wallet updated = walletStore.update(credited);

                outboxService.saveEvent(AGGREGATE_TYPE, TransactionAppliedEvent.of(transaction, updated));
                return transaction;
            });

            Duration duration = elapsedSince(start);
            ledgerMetrics.recordTransactionApplied(LedgerMetrics.RESULT_SUCCESS);
            ledgerMetrics.recordLatency("apply_transaction", LedgerMetrics.RESULT_SUCCESS, duration);
            log.info("Transaction applied: transactionId={}, amount={}, duration={}ms",
                applied.getId(), amount, duration.toMillis());
            return applied;

        } catch (LedgerException e) {
            ledgerMetrics.recordTransactionApplied(e.getErrorCode());
            ledgerMetrics.recordLatency("apply_transaction", e.getErrorCode(), elapsedSince(start));
            log.warn("Transaction rejected: reason={}, message={}", e.getErrorCode(), e.getMessage());
            throw e;
        } catch (CancellationException e) {
            ledgerMetrics.recordTransactionApplied(LedgerMetrics.RESULT_CANCELLED);
            ledgerMetrics.recordLatency("apply_transaction", LedgerMetrics.RESULT_CANCELLED, elapsedSince(start));
            log.info("Transaction cancelled while waiting for the wallet lock");
            throw e;
        } catch (RuntimeException e) {
            ledgerMetrics.recordTransactionApplied(LedgerMetrics.RESULT_ERROR);
            ledgerMetrics.recordLatency("apply_transaction", LedgerMetrics.RESULT_ERROR, elapsedSince(start));
            log.error("Transaction failed unexpectedly: amount={}", amount, e);
            throw e;
        } finally {
            CorrelationContext.clearWalletScope();
        }
    }

    public Wallet deactivateWallet(UUID walletId) {
        return deactivateWallet(walletId, defaultLockTimeout());
    }

    /**
     * Deactivates a wallet and every one of its transactions in one atomic step.
     *
     * The wallet and all cascaded transactions receive the same deactivatedAt.
     * Deactivating an already inactive wallet returns it unchanged.
     *
     * @throws com.flagship.wallet_ledger.ledger.exception.WalletNotFoundException if the wallet does not exist
     * @throws LockTimeoutException if the wallet stayed locked longer than {@code lockTimeout}
     */
    public Wallet deactivateWallet(UUID walletId, Duration lockTimeout) {
        requireWalletId(walletId);
        requireTimeout(lockTimeout);

        long start = System.nanoTime();
        CorrelationContext.enterWalletScope(walletId, null);
        try {
            DeactivationOutcome outcome = runLocked(walletId, lockTimeout, rowLockBudget -> {
                Wallet wallet = walletStore.lockById(walletId, rowLockBudget);
                if (!wallet.isActive()) {
                    return new DeactivationOutcome(wallet, 0, false);
                }

                Instant now = now();
                // Wallet first, so no transaction is ever inactive under an active wallet
                Wallet deactivated = walletStore.update(wallet.deactivate(now));
                int cascaded = transactionStore.deactivateAllForWallet(walletId, now);

                outboxService.saveEvent(AGGREGATE_TYPE, WalletDeactivatedEvent.of(deactivated, cascaded));
                return new DeactivationOutcome(deactivated, cascaded, true);
            });

            ledgerMetrics.recordWalletDeactivated(outcome.isChanged(), outcome.getCascaded());
            ledgerMetrics.recordLatency("deactivate_wallet", LedgerMetrics.RESULT_SUCCESS, elapsedSince(start));
            if (outcome.isChanged()) {
                log.info("Wallet deactivated: cascadedTransactions={}, finalBalance={}",
                    outcome.getCascaded(), outcome.getWallet().getBalance());
            } else {
                log.info("Wallet already inactive since {}, nothing to do",
                    outcome.getWallet().getDeactivatedAt());
            }
            return outcome.getWallet();

        } catch (LedgerException e) {
            ledgerMetrics.recordLatency("deactivate_wallet", e.getErrorCode(), elapsedSince(start));
            log.warn("Deactivation rejected: reason={}, message={}", e.getErrorCode(), e.getMessage());
            throw e;
        } catch (CancellationException e) {
            ledgerMetrics.recordLatency("deactivate_wallet", LedgerMetrics.RESULT_CANCELLED, elapsedSince(start));
            log.info("Deactivation cancelled while waiting for the wallet lock");
            throw e;
        } catch (RuntimeException e) {
            ledgerMetrics.recordLatency("deactivate_wallet", LedgerMetrics.RESULT_ERROR, elapsedSince(start));
            log.error("Deactivation failed unexpectedly", e);
            throw e;
        } finally {
            CorrelationContext.clearWalletScope();
        }
    }

    public Wallet updateLabel(UUID walletId, String label) {
        return updateLabel(walletId, label, defaultLockTimeout());
    }

    /**
     * Replaces a wallet's label. Works on deactivated wallets too; balance and
     * active state are untouched.
     *
     * @throws com.flagship.wallet_ledger.ledger.exception.WalletNotFoundException if the wallet does not exist
     * @throws com.flagship.wallet_ledger.ledger.exception.InvalidLabelException if the label is blank or too long
     * @throws LockTimeoutException if the wallet stayed locked longer than {@code lockTimeout}
     */
    public Wallet updateLabel(UUID walletId, String label, Duration lockTimeout) {
        requireWalletId(walletId);
        requireTimeout(lockTimeout);

        long start = System.nanoTime();
        CorrelationContext.enterWalletScope(walletId, null);
        try {
            Wallet updated = runLocked(walletId, lockTimeout, rowLockBudget -> {
                Wallet wallet = walletStore.lockById(walletId, rowLockBudget);
                String normalized = Wallet.normalizeLabel(label, properties.getWallet().getLabelMaxLength());

                Wallet relabeled = walletStore.update(wallet.relabel(normalized, now()));
                outboxService.saveEvent(AGGREGATE_TYPE, WalletLabelUpdatedEvent.of(wallet.getLabel(), relabeled));
                return relabeled;
            });

            ledgerMetrics.recordLatency("update_label", LedgerMetrics.RESULT_SUCCESS, elapsedSince(start));
            log.info("Wallet label updated: label={}", updated.getLabel());
            return updated;

        } catch (LedgerException e) {
            ledgerMetrics.recordLatency("update_label", e.getErrorCode(), elapsedSince(start));
            log.warn("Label update rejected: reason={}, message={}", e.getErrorCode(), e.getMessage());
            throw e;
        } catch (CancellationException e) {
            ledgerMetrics.recordLatency("update_label", LedgerMetrics.RESULT_CANCELLED, elapsedSince(start));
            log.info("Label update cancelled while waiting for the wallet lock");
            throw e;
        } catch (RuntimeException e) {
            ledgerMetrics.recordLatency("update_label", LedgerMetrics.RESULT_ERROR, elapsedSince(start));
            log.error("Label update failed unexpectedly", e);
            throw e;
        } finally {
            CorrelationContext.clearWalletScope();
        }
    }

    /**
     * Returns every transaction (active or not) of the listed wallets, oldest first.
     *
     * Takes no wallet lock, so it never waits on a running mutation and never sees
     * a half-applied one. Unknown ids contribute nothing; an empty input gives an
     * empty result.
     */
    @Transactional(readOnly = true)
    public List<WalletTransaction> searchTransactions(Collection<UUID> walletIds) {
        if (walletIds == null) {
            throw new IllegalArgumentException("walletIds cannot be null");
        }
        if (walletIds.isEmpty()) {
            return List.of();
        }
        Set<UUID> distinct = new LinkedHashSet<>(walletIds);
        if (distinct.contains(null)) {
            throw new IllegalArgumentException("walletIds cannot contain null");
        }
        List<WalletTransaction> found = transactionStore.findByWalletIds(distinct);
        log.debug("Found {} transactions for {} wallets", found.size(), distinct.size());
        return found;
    }

    // ==================== Lookups ====================

    /**
     * @throws com.flagship.wallet_ledger.ledger.exception.WalletNotFoundException if the wallet does not exist
     */
    @Transactional(readOnly = true)
    public Wallet getWallet(UUID walletId) {
        requireWalletId(walletId);
        return walletStore.getById(walletId);
    }

    @Transactional(readOnly = true)
    public List<Wallet> listWallets(WalletFilter filter) {
        return walletStore.findAll(filter != null ? filter : WalletFilter.all());
    }

    /**
     * Looks up an active transaction by its external id. A transaction cascaded
     * inactive by its wallet's deactivation is reported as not found; it still
     * shows up in {@link #searchTransactions(Collection)}.
     *
     * @throws TransactionNotFoundException if no active transaction uses this txid
     */
    @Transactional(readOnly = true)
    public WalletTransaction getTransactionByTxid(String txid) {
        validateTxid(txid);
        return transactionStore.findByTxid(txid)
            .filter(WalletTransaction::isActive)
            .orElseThrow(() -> new TransactionNotFoundException(txid));
    }

    @Transactional(readOnly = true)
    public List<WalletTransaction> getTransactionsForWallet(UUID walletId) {
        requireWalletId(walletId);
        return searchTransactions(List.of(walletId));
    }

    // ==================== Helpers ====================

    /**
     * Runs {@code work} in a new database transaction while holding the wallet lock.
     * The commit happens before the lock is released.
     *
     * {@code lockTimeout} bounds both waits together: {@code work} receives what is
     * left of it after the in-process lock was granted, to use as the row lock budget.
     */
    private <T> T runLocked(UUID walletId, Duration lockTimeout, Function<Duration, T> work) {
        long deadline = System.nanoTime() + lockTimeout.toNanos();
        try {
            return lockManager.executeLocked(walletId, lockTimeout, () -> {
                Duration rowLockBudget = remainingBudget(walletId, lockTimeout, deadline);
                return transactionOperations.execute(status -> work.apply(rowLockBudget));
            });
        } catch (LockTimeoutException e) {
            ledgerMetrics.incrementLockTimeouts();
            throw e;
        } catch (PessimisticLockingFailureException e) {
            // Row lock held by another process for longer than lock_timeout
            ledgerMetrics.incrementLockTimeouts();
            throw new LockTimeoutException(walletId, lockTimeout, e);
        }
    }

    /**
     * Zero timeout means a single attempt at each lock, so it passes through as zero.
     */
    private static Duration remainingBudget(UUID walletId, Duration lockTimeout, long deadline) {
        if (lockTimeout.isZero()) {
            return Duration.ZERO;
        }
        long remaining = deadline - System.nanoTime();
        if (remaining <= 0) {
            throw new LockTimeoutException(walletId, lockTimeout);
        }
        return Duration.ofNanos(remaining);
    }

    /**
     * Truncated to microseconds, the precision PostgreSQL stores, so values read
     * back compare equal to the ones written.
     */
    private Instant now() {
        return Instant.now(clock).truncatedTo(ChronoUnit.MICROS);
    }

    private Duration defaultLockTimeout() {
        return properties.getLock().getTimeout();
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    private static void requireWalletId(UUID walletId) {
        if (walletId == null) {
            throw new IllegalArgumentException("walletId cannot be null");
        }
    }

    private static void requireTimeout(Duration lockTimeout) {
        if (lockTimeout == null || lockTimeout.isNegative()) {
            throw new IllegalArgumentException("lockTimeout must be zero or positive, got " + lockTimeout);
        }
    }

    private static void validateTxid(String txid) {
        if (txid == null || txid.isBlank()) {
            throw new IllegalArgumentException("txid cannot be blank");
        }
        if (txid.length() > TXID_MAX_LENGTH) {
            throw new IllegalArgumentException(
                String.format("txid must be at most %d characters, got %d", TXID_MAX_LENGTH, txid.length()));
        }
    }

    private static void validateAmount(BigDecimal amount) {
        if (amount == null) {
            throw new IllegalArgumentException("amount cannot be null");
        }
        if (amount.signum() == 0) {
            throw new IllegalArgumentException("amount must be non-zero");
        }
        if (amount.stripTrailingZeros().scale() > AMOUNT_MAX_SCALE) {
            throw new IllegalArgumentException(
                String.format("amount %s has more than %d decimal places", amount.toPlainString(), AMOUNT_MAX_SCALE));
        }
        if (Wallet.integerDigits(amount) > Wallet.MAX_INTEGER_DIGITS) {
            throw new IllegalArgumentException(
                String.format("amount %s has more than %d integer digits", amount.toPlainString(), Wallet.MAX_INTEGER_DIGITS));
        }
    }

    @Value
    private static class DeactivationOutcome {
        Wallet wallet;
        int cascaded;
        boolean changed;
    }
}

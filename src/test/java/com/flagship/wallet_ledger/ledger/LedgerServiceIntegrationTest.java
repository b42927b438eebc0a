package com.flagship.wallet_ledger.ledger;

import com.flagship.wallet_ledger.ledger.event.TransactionAppliedEvent;
import com.flagship.wallet_ledger.ledger.event.WalletCreatedEvent;
import com.flagship.wallet_ledger.ledger.event.WalletDeactivatedEvent;
import com.flagship.wallet_ledger.ledger.exception.BalanceLimitExceededException;
import com.flagship.wallet_ledger.ledger.exception.DuplicateTransactionIdException;
import com.flagship.wallet_ledger.ledger.exception.InsufficientBalanceException;
import com.flagship.wallet_ledger.ledger.exception.LockTimeoutException;
import com.flagship.wallet_ledger.ledger.exception.WalletInactiveException;
import com.flagship.wallet_ledger.outbox.OutboxEvent;
import com.flagship.wallet_ledger.outbox.OutboxService;
import com.flagship.wallet_ledger.transaction.WalletTransaction;
import com.flagship.wallet_ledger.wallet.Wallet;
import com.flagship.wallet_ledger.wallet.WalletFilter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.SpyBean;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;

/**
 * Ledger guarantees against a real PostgreSQL.
 *
 * These tests exercise the parts the in-memory tests cannot: the unique
 * constraint on txid, SELECT ... FOR UPDATE with lock_timeout, the bulk cascade
 * UPDATE and rollback of the whole database transaction.
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class LedgerServiceIntegrationTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("wallet_ledger_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        // No broker in these tests
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("spring.kafka.admin.auto-create", () -> "false");
        registry.add("outbox.publisher.enabled", () -> "false");
    }

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private PlatformTransactionManager transactionManager;

    @Autowired
    private WalletLockManager lockManager;

    @SpyBean
    private OutboxService outboxService;

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ VERIFIED: " + message);
    }

    private static BigDecimal amount(String value) {
        return new BigDecimal(value);
    }

    private static String txid(String prefix) {
        return prefix + "-" + UUID.randomUUID();
    }

    private BigDecimal balanceOf(UUID walletId) {
        return jdbcTemplate.queryForObject("SELECT balance FROM wallets WHERE id = ?", BigDecimal.class, walletId);
    }

    private BigDecimal sumOfAmounts(UUID walletId) {
        return jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(amount), 0) FROM wallet_transactions WHERE wallet_id = ?",
            BigDecimal.class, walletId);
    }

    private int countTransactions(UUID walletId) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM wallet_transactions WHERE wallet_id = ?", Integer.class, walletId);
        return count != null ? count : 0;
    }

    @Nested
    @DisplayName("Walkthrough")
    class Walkthrough {

        @Test
        @DisplayName("credit, duplicate, debit, deactivate, rejected credit")
        void fullLifecycle() {
            printTestHeader("Wallet lifecycle on PostgreSQL");
            UUID w1 = ledgerService.createWallet("W1").getId();
            String t1 = txid("t1");
            String t2 = txid("t2");

            ledgerService.applyTransaction(w1, t1, amount("100.00"));
            assertEquals(0, amount("100.00").compareTo(balanceOf(w1)));

            assertThrows(DuplicateTransactionIdException.class,
                () -> ledgerService.applyTransaction(w1, t1, amount("50.00")));
            assertEquals(0, amount("100.00").compareTo(balanceOf(w1)));

            ledgerService.applyTransaction(w1, t2, amount("-30.00"));
            assertEquals(0, amount("70.00").compareTo(balanceOf(w1)));

            Wallet deactivated = ledgerService.deactivateWallet(w1);
            assertFalse(deactivated.isActive());

            Integer mismatched = jdbcTemplate.queryForObject("""
                SELECT COUNT(*) FROM wallet_transactions t
                JOIN wallets w ON w.id = t.wallet_id
                WHERE w.id = ? AND (t.is_active OR t.deactivated_at IS DISTINCT FROM w.deactivated_at)
                """, Integer.class, w1);
            assertEquals(0, mismatched);

            List<WalletTransaction> transactions = ledgerService.getTransactionsForWallet(w1);
            assertEquals(List.of(t1, t2), transactions.stream().map(WalletTransaction::getTxid).toList());
            assertTrue(transactions.stream().allMatch(t -> deactivated.getDeactivatedAt().equals(t.getDeactivatedAt())));

            assertThrows(WalletInactiveException.class,
                () -> ledgerService.applyTransaction(w1, txid("t3"), amount("10.00")));
            assertEquals(0, amount("70.00").compareTo(balanceOf(w1)));
            assertEquals(2, countTransactions(w1));

            List<String> eventTypes = outboxService.getEventsForAggregate("Wallet", w1).stream()
                .map(OutboxEvent::getEventType)
                .toList();
            assertEquals(List.of(
                WalletCreatedEvent.EVENT_TYPE,
                TransactionAppliedEvent.EVENT_TYPE,
                TransactionAppliedEvent.EVENT_TYPE,
                WalletDeactivatedEvent.EVENT_TYPE), eventTypes);

            printSuccess("balance, cascade and outbox agree with the accepted operations");
        }

        @Test
        @DisplayName("second deactivation changes nothing")
        void deactivateTwice() {
            UUID walletId = ledgerService.createWallet("twice").getId();
            ledgerService.applyTransaction(walletId, txid("d"), amount("1"));

            Wallet first = ledgerService.deactivateWallet(walletId);
            Wallet second = ledgerService.deactivateWallet(walletId);

            assertEquals(first.getDeactivatedAt(), second.getDeactivatedAt());
            assertEquals(first.getUpdatedAt(), second.getUpdatedAt());
            long deactivationEvents = outboxService.getEventsForAggregate("Wallet", walletId).stream()
                .filter(e -> e.getEventType().equals(WalletDeactivatedEvent.EVENT_TYPE))
                .count();
            assertEquals(1, deactivationEvents);
        }

        @Test
        @DisplayName("reads return what was written, to the microsecond")
        void roundTrip() {
            UUID walletId = ledgerService.createWallet("  trimmed  ").getId();
            String id = txid("rt");

            WalletTransaction applied = ledgerService.applyTransaction(walletId, id, amount("12.3456"));
            WalletTransaction loaded = ledgerService.getTransactionByTxid(id);

            assertEquals(applied.getId(), loaded.getId());
            assertEquals(applied.getCreatedAt(), loaded.getCreatedAt());
            assertEquals(0, applied.getAmount().compareTo(loaded.getAmount()));
            assertEquals("trimmed", ledgerService.getWallet(walletId).getLabel());
        }

        @Test
        @DisplayName("label update works after deactivation")
        void relabelInactive() {
            UUID walletId = ledgerService.createWallet("before").getId();
            ledgerService.deactivateWallet(walletId);

            Wallet updated = ledgerService.updateLabel(walletId, "after");

            assertEquals("after", updated.getLabel());
            assertFalse(ledgerService.getWallet(walletId).isActive());
        }

        @Test
        @DisplayName("wallet listing filters by id and state")
        void listWallets() {
            UUID rich = ledgerService.createWallet("rich").getId();
            UUID poor = ledgerService.createWallet("poor").getId();
            UUID closed = ledgerService.createWallet("closed").getId();
            ledgerService.applyTransaction(rich, txid("r"), amount("500"));
            ledgerService.applyTransaction(poor, txid("p"), amount("5"));
            ledgerService.deactivateWallet(closed);

            List<UUID> mine = ledgerService.listWallets(WalletFilter.builder()
                    .walletIds(Set.of(rich, poor, closed))
                    .build())
                .stream().map(Wallet::getId).toList();
            List<UUID> mineActive = ledgerService.listWallets(WalletFilter.builder()
                    .walletIds(Set.of(rich, poor, closed))
                    .active(true)
                    .build())
                .stream().map(Wallet::getId).toList();

            assertEquals(List.of(rich, poor, closed), mine);
            assertEquals(List.of(rich, poor), mineActive);
        }
    }

    @Nested
    @DisplayName("Atomicity")
    class Atomicity {

        @Test
        @DisplayName("an overdraft is rejected under the row lock and leaves no row")
        void overdraftRejected() {
            UUID walletId = ledgerService.createWallet("overdraft").getId();
            ledgerService.applyTransaction(walletId, txid("fund"), amount("20.00"));
            String debit = txid("debit");

            assertThrows(InsufficientBalanceException.class,
                () -> ledgerService.applyTransaction(walletId, debit, amount("-20.01")));

            assertEquals(0, amount("20.00").compareTo(balanceOf(walletId)));
            assertEquals(1, countTransactions(walletId));
            ledgerService.applyTransaction(walletId, debit, amount("-20.00"));
            assertEquals(0, BigDecimal.ZERO.compareTo(balanceOf(walletId)));
        }

        @Test
        @DisplayName("a balance the column cannot hold is a typed rejection")
        void balanceLimit() {
            UUID walletId = ledgerService.createWallet("whale").getId();
            ledgerService.applyTransaction(walletId, txid("max"), amount("999999999999999.9999"));

            assertThrows(BalanceLimitExceededException.class,
                () -> ledgerService.applyTransaction(walletId, txid("over"), amount("0.0001")));
            assertThrows(IllegalArgumentException.class,
                () -> ledgerService.applyTransaction(walletId, txid("huge"), amount("1E+20")));

            assertEquals(0, amount("999999999999999.9999").compareTo(balanceOf(walletId)));
            assertEquals(1, countTransactions(walletId));
        }

        @Test
        @DisplayName("a failure after the insert rolls back transaction and balance")
        void rollbackOnOutboxFailure() {
            printTestHeader("Rollback when the outbox write fails");
            UUID walletId = ledgerService.createWallet("atomic").getId();
            String id = txid("rollback");
            doThrow(new IllegalStateException("outbox unavailable"))
                .when(outboxService).saveEvent(eq("Wallet"), any(TransactionAppliedEvent.class));

            assertThrows(IllegalStateException.class,
                () -> ledgerService.applyTransaction(walletId, id, amount("10")));

            assertEquals(0, BigDecimal.ZERO.compareTo(balanceOf(walletId)));
            assertEquals(0, countTransactions(walletId));
            printSuccess("no partial state after the failure");
        }

        @Test
        @DisplayName("a failed cascade leaves the wallet active")
        void rollbackDeactivation() {
            UUID walletId = ledgerService.createWallet("cascade-fail").getId();
            ledgerService.applyTransaction(walletId, txid("c"), amount("3"));
            doThrow(new IllegalStateException("outbox unavailable"))
                .when(outboxService).saveEvent(eq("Wallet"), any(WalletDeactivatedEvent.class));

            assertThrows(IllegalStateException.class, () -> ledgerService.deactivateWallet(walletId));

            assertTrue(ledgerService.getWallet(walletId).isActive());
            assertTrue(ledgerService.getTransactionsForWallet(walletId).stream().allMatch(WalletTransaction::isActive));
        }
    }

    @Nested
    @DisplayName("Concurrency")
    class Concurrency {

        @Test
        @DisplayName("concurrent credits on one wallet keep balance equal to the sum")
        void concurrentCredits() throws Exception {
            printTestHeader("Concurrent credits on PostgreSQL");
            UUID walletId = ledgerService.createWallet("hot").getId();
            int threadCount = 12;
            int perThread = 5;
            ExecutorService executor = Executors.newFixedThreadPool(threadCount);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<?>> futures = new ArrayList<>();

            for (int i = 0; i < threadCount; i++) {
                int thread = i;
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int j = 0; j < perThread; j++) {
                        ledgerService.applyTransaction(walletId, "cc-" + walletId + "-" + thread + "-" + j, amount("1.25"));
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(60, TimeUnit.SECONDS);
            }
            executor.shutdown();

            assertEquals(0, amount("75.00").compareTo(balanceOf(walletId)));
            assertEquals(0, sumOfAmounts(walletId).compareTo(balanceOf(walletId)));
            assertEquals(threadCount * perThread, countTransactions(walletId));
            printSuccess("balance = sum(amount) after 60 concurrent credits");
        }

        @Test
        @DisplayName("same txid on different wallets: the unique constraint admits one")
        void concurrentDuplicateTxid() throws Exception {
            int threadCount = 8;
            List<UUID> wallets = new ArrayList<>();
            for (int i = 0; i < threadCount; i++) {
                wallets.add(ledgerService.createWallet("dup-" + i).getId());
            }
            String shared = txid("shared");
            ExecutorService executor = Executors.newFixedThreadPool(threadCount);
            CountDownLatch start = new CountDownLatch(1);
            CountDownLatch done = new CountDownLatch(threadCount);
            AtomicInteger successes = new AtomicInteger();
            AtomicInteger duplicates = new AtomicInteger();
            AtomicReference<Throwable> unexpected = new AtomicReference<>();

            for (UUID walletId : wallets) {
                executor.submit(() -> {
                    try {
                        start.await();
                        ledgerService.applyTransaction(walletId, shared, amount("10"));
                        successes.incrementAndGet();
                    } catch (DuplicateTransactionIdException e) {
                        duplicates.incrementAndGet();
                    } catch (Throwable t) {
                        unexpected.set(t);
                    } finally {
                        done.countDown();
                    }
                });
            }
            start.countDown();
            assertTrue(done.await(60, TimeUnit.SECONDS));
            executor.shutdown();

            assertNull(unexpected.get());
            assertEquals(1, successes.get());
            assertEquals(threadCount - 1, duplicates.get());
            BigDecimal total = wallets.stream().map(this::balance).reduce(BigDecimal.ZERO, BigDecimal::add);
            assertEquals(0, amount("10").compareTo(total));
        }

        private BigDecimal balance(UUID walletId) {
            return balanceOf(walletId);
        }

        @Test
        @DisplayName("a row lock held by another process times out the mutation")
        void rowLockTimeout() throws Exception {
            printTestHeader("Row lock held outside this process");
            UUID walletId = ledgerService.createWallet("locked").getId();
            TransactionTemplate external = new TransactionTemplate(transactionManager);
            external.setPropagationBehavior(TransactionTemplate.PROPAGATION_REQUIRES_NEW);
            CountDownLatch held = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            ExecutorService executor = Executors.newSingleThreadExecutor();

            Future<?> holder = executor.submit(() -> external.executeWithoutResult(status -> {
                jdbcTemplate.queryForList("SELECT id FROM wallets WHERE id = ? FOR UPDATE", walletId);
                held.countDown();
                try {
                    release.await(30, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }));
            assertTrue(held.await(10, TimeUnit.SECONDS));

            try {
                LockTimeoutException e = assertThrows(LockTimeoutException.class,
                    () -> ledgerService.applyTransaction(walletId, txid("blocked"), amount("5"), Duration.ofMillis(300)));
                assertTrue(e.isRetryable());
            } finally {
                release.countDown();
                holder.get(10, TimeUnit.SECONDS);
                executor.shutdown();
            }

            assertEquals(0, BigDecimal.ZERO.compareTo(balanceOf(walletId)));
            assertEquals(0, countTransactions(walletId));

            ledgerService.applyTransaction(walletId, txid("unblocked"), amount("5"));
            assertEquals(0, amount("5").compareTo(balanceOf(walletId)));
            printSuccess("timed out cleanly, succeeded once the lock was gone");
        }

        @Test
        @DisplayName("wallet lock wait and row lock wait share one timeout")
        void combinedWaitStaysWithinTimeout() throws Exception {
            printTestHeader("Both lock waits bounded by one timeout");
            UUID walletId = ledgerService.createWallet("double-wait").getId();
            TransactionTemplate external = new TransactionTemplate(transactionManager);
            external.setPropagationBehavior(TransactionTemplate.PROPAGATION_REQUIRES_NEW);
            CountDownLatch rowHeld = new CountDownLatch(1);
            CountDownLatch walletHeld = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            ExecutorService executor = Executors.newFixedThreadPool(2);

            Future<?> rowHolder = executor.submit(() -> external.executeWithoutResult(status -> {
                jdbcTemplate.queryForList("SELECT id FROM wallets WHERE id = ? FOR UPDATE", walletId);
                rowHeld.countDown();
                try {
                    release.await(30, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }));
            assertTrue(rowHeld.await(10, TimeUnit.SECONDS));
            Future<?> walletHolder = executor.submit(() -> lockManager.executeLocked(walletId, Duration.ofSeconds(5), () -> {
                walletHeld.countDown();
                try {
                    Thread.sleep(300);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return null;
            }));
            assertTrue(walletHeld.await(10, TimeUnit.SECONDS));

            long start = System.nanoTime();
            try {
                assertThrows(LockTimeoutException.class,
                    () -> ledgerService.applyTransaction(walletId, txid("squeezed"), amount("1"), Duration.ofMillis(600)));
                long elapsedMillis = Duration.ofNanos(System.nanoTime() - start).toMillis();
                // Sequential full waits would take 300ms + 600ms
                assertTrue(elapsedMillis < 850, "gave up after " + elapsedMillis + "ms");
            } finally {
                release.countDown();
                walletHolder.get(10, TimeUnit.SECONDS);
                rowHolder.get(10, TimeUnit.SECONDS);
                executor.shutdown();
            }
            assertEquals(0, countTransactions(walletId));
            printSuccess("gave up within the caller's timeout");
        }

        @Test
        @DisplayName("searches do not wait for a running mutation")
        void searchNotBlocked() throws Exception {
            UUID walletId = ledgerService.createWallet("reader").getId();
            ledgerService.applyTransaction(walletId, txid("seen"), amount("1"));
            TransactionTemplate external = new TransactionTemplate(transactionManager);
            external.setPropagationBehavior(TransactionTemplate.PROPAGATION_REQUIRES_NEW);
            CountDownLatch held = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            ExecutorService executor = Executors.newSingleThreadExecutor();

            Future<?> writer = executor.submit(() -> external.executeWithoutResult(status -> {
                jdbcTemplate.queryForList("SELECT id FROM wallets WHERE id = ? FOR UPDATE", walletId);
                jdbcTemplate.update("UPDATE wallet_transactions SET is_active = false, deactivated_at = now() WHERE wallet_id = ?", walletId);
                held.countDown();
                try {
                    release.await(30, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                status.setRollbackOnly();
            }));
            assertTrue(held.await(10, TimeUnit.SECONDS));

            try {
                List<WalletTransaction> found = ledgerService.searchTransactions(List.of(walletId));
                assertEquals(1, found.size());
                assertTrue(found.get(0).isActive());
            } finally {
                release.countDown();
                writer.get(10, TimeUnit.SECONDS);
                executor.shutdown();
            }
        }
    }
}

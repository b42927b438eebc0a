package com.flagship.wallet_ledger.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized metrics for ledger operations.
 *
 * Metrics exposed:
 * - ledger.transactions.applied{result}: outcome of every ApplyTransaction call
 * - ledger.wallets.created: wallets opened
 * - ledger.wallets.deactivated{result}: deactivated / already_inactive
 * - ledger.transactions.cascaded: transactions flipped inactive by a deactivation
 * - ledger.lock.timeouts: lock waits that gave up
 * - ledger.operation.latency{operation,outcome}: wall time per operation
 */
@Component
public class LedgerMetrics {

    public static final String RESULT_SUCCESS = "success";
    public static final String RESULT_ERROR = "error";
    public static final String RESULT_CANCELLED = "cancelled";

    private final MeterRegistry registry;

    private final Counter walletsCreated;
    private final Counter transactionsCascaded;
    private final Counter lockTimeouts;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.walletsCreated = Counter.builder("ledger.wallets.created")
                .description("Number of wallets created")
                .register(registry);

        this.transactionsCascaded = Counter.builder("ledger.transactions.cascaded")
                .description("Transactions deactivated by a wallet deactivation")
                .register(registry);

        this.lockTimeouts = Counter.builder("ledger.lock.timeouts")
                .description("Wallet lock waits that timed out")
                .register(registry);
    }

    public void incrementWalletsCreated() {
        walletsCreated.increment();
    }

    /**
     * @param result "success" or the error code of the rejection
     */
    public void recordTransactionApplied(String result) {
        registry.counter("ledger.transactions.applied",
                "result", sanitizeTag(result)
        ).increment();
    }

    /**
     * @param changed false when the wallet was already inactive
     */
    public void recordWalletDeactivated(boolean changed, int cascaded) {
        registry.counter("ledger.wallets.deactivated",
                "result", changed ? "deactivated" : "already_inactive"
        ).increment();
        if (cascaded > 0) {
            transactionsCascaded.increment(cascaded);
        }
    }

    public void incrementLockTimeouts() {
        lockTimeouts.increment();
    }

    public void recordLatency(String operation, String outcome, Duration duration) {
        Timer.builder("ledger.operation.latency")
                .description("Latency of ledger operations")
                .tag("operation", sanitizeTag(operation))
                .tag("outcome", sanitizeTag(outcome))
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry)
                .record(duration);
    }

    /**
     * Keeps tag values in a small, safe alphabet to avoid cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}

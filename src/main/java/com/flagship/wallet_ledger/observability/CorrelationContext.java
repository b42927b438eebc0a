package com.flagship.wallet_ledger.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Thread-local correlation id plus the MDC keys used across the service.
 *
 * The correlation id is taken from the X-Correlation-ID request header or
 * generated. Wallet id and txid are added to the MDC by the ledger for the
 * duration of one operation.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String WALLET_ID_MDC_KEY = "walletId";
    public static final String TXID_MDC_KEY = "txid";

    private static final ThreadLocal<String> correlationId = new ThreadLocal<>();

    private CorrelationContext() {
        // Utility class
    }

    /**
     * Gets the current correlation ID, or generates a new one if not set.
     */
    public static String getCorrelationId() {
        String id = correlationId.get();
        if (id == null) {
            id = generateCorrelationId();
            correlationId.set(id);
        }
        return id;
    }

    public static void setCorrelationId(String id) {
        if (id != null && !id.isBlank()) {
            correlationId.set(id);
        } else {
            correlationId.set(generateCorrelationId());
        }
    }

    public static void clear() {
        correlationId.remove();
    }

    /**
     * Short form for readability in logs.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    public static boolean hasCorrelationId() {
        return correlationId.get() != null;
    }

    /**
     * Puts the wallet id (and txid, when given) into the MDC.
     * Pair with {@link #clearWalletScope()} in a finally block.
     */
    public static void enterWalletScope(UUID walletId, String txid) {
        if (walletId != null) {
            MDC.put(WALLET_ID_MDC_KEY, walletId.toString());
        }
        if (txid != null) {
            MDC.put(TXID_MDC_KEY, txid);
        }
    }

    public static void clearWalletScope() {
        MDC.remove(WALLET_ID_MDC_KEY);
        MDC.remove(TXID_MDC_KEY);
    }
}

package com.flagship.wallet_ledger.ledger.exception;

/**
 * Base class for every typed failure reported by the ledger.
 *
 * All ledger failures are terminal for the current call: the ledger never
 * retries on its own, and durable state is unchanged whenever one is thrown.
 * {@link #isRetryable()} tells callers whether resubmitting the exact same
 * request can succeed.
 */
public abstract class LedgerException extends RuntimeException {

    protected LedgerException(String message) {
        super(message);
    }

    protected LedgerException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Stable, lower-case code used for log fields and metric tags.
     */
    public abstract String getErrorCode();

    /**
     * Whether the same request may succeed if sent again unchanged.
     */
    public boolean isRetryable() {
        return false;
    }
}

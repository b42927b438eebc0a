package com.flagship.wallet_ledger.ledger.exception;

import lombok.Getter;

import java.time.Duration;
import java.util.UUID;

/**
 * Raised when exclusive access to a wallet could not be obtained in time.
 * Nothing was changed, so the request can be sent again as is.
 */
@Getter
public class LockTimeoutException extends LedgerException {

    private final UUID walletId;
    private final Duration timeout;

    public LockTimeoutException(UUID walletId, Duration timeout) {
        super(String.format("Timed out after %d ms waiting for exclusive access to wallet %s",
                timeout.toMillis(), walletId));
        this.walletId = walletId;
        this.timeout = timeout;
    }

    public LockTimeoutException(UUID walletId, Duration timeout, Throwable cause) {
        super(String.format("Timed out after %d ms waiting for exclusive access to wallet %s",
                timeout.toMillis(), walletId), cause);
        this.walletId = walletId;
        this.timeout = timeout;
    }

    @Override
    public String getErrorCode() {
        return "lock_timeout";
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}

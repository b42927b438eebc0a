package com.flagship.wallet_ledger.transaction;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A signed amount applied exactly once to a wallet, identified externally by its txid.
 *
 * Amount and wallet never change after creation. The only later transition is
 * becoming inactive when the owning wallet is deactivated, which is done in bulk
 * by {@link TransactionStore#deactivateAllForWallet(UUID, Instant)}.
 */
@Value
public class WalletTransaction {
    UUID id;
    UUID walletId;
    String txid;
    BigDecimal amount;         // positive = credit, negative = debit
    boolean active;
    Instant deactivatedAt;     // null while active
    Instant createdAt;
    Instant updatedAt;

    public static WalletTransaction create(UUID walletId, String txid, BigDecimal amount, Instant now) {
        if (amount == null || amount.signum() == 0) {
            throw new IllegalArgumentException("Transaction amount must be non-zero");
        }
        return new WalletTransaction(
            UUID.randomUUID(),
            walletId,
            txid,
            amount,
            true,
            null,
            now,
            now
        );
    }

    public boolean isCredit() {
        return amount.signum() > 0;
    }

    public boolean isDebit() {
        return amount.signum() < 0;
    }
}

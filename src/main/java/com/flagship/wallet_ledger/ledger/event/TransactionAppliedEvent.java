package com.flagship.wallet_ledger.ledger.event;

import com.flagship.wallet_ledger.transaction.WalletTransaction;
import com.flagship.wallet_ledger.wallet.Wallet;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Event published when a transaction has been applied to a wallet balance.
 *
 * Carries the balance right after the application so consumers can keep a
 * projection without reading back.
 */
@Value
public class TransactionAppliedEvent implements LedgerEvent {
    UUID eventId;
    UUID walletId;
    UUID transactionId;
    String txid;
    BigDecimal amount;
    BigDecimal balanceAfter;
    Instant occurredAt;

    public static final String EVENT_TYPE = "TransactionApplied";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static TransactionAppliedEvent of(WalletTransaction transaction, Wallet walletAfter) {
        return new TransactionAppliedEvent(
            UUID.randomUUID(),
            walletAfter.getId(),
            transaction.getId(),
            transaction.getTxid(),
            transaction.getAmount(),
            walletAfter.getBalance(),
            transaction.getCreatedAt()
        );
    }
}

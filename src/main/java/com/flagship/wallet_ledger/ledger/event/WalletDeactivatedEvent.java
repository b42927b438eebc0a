package com.flagship.wallet_ledger.ledger.event;

import com.flagship.wallet_ledger.wallet.Wallet;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Event published when a wallet is deactivated.
 *
 * The deactivation is terminal. All transactions of the wallet were marked
 * inactive in the same database transaction; their count is included.
 */
@Value
public class WalletDeactivatedEvent implements LedgerEvent {
    UUID eventId;
    UUID walletId;
    BigDecimal finalBalance;
    int deactivatedTransactions;
    Instant occurredAt;

    public static final String EVENT_TYPE = "WalletDeactivated";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static WalletDeactivatedEvent of(Wallet wallet, int deactivatedTransactions) {
        return new WalletDeactivatedEvent(
            UUID.randomUUID(),
            wallet.getId(),
            wallet.getBalance(),
            deactivatedTransactions,
            wallet.getDeactivatedAt()
        );
    }
}

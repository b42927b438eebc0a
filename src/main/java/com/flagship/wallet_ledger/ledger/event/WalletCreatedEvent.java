package com.flagship.wallet_ledger.ledger.event;

import com.flagship.wallet_ledger.wallet.Wallet;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Event published when a new wallet is opened.
 */
@Value
public class WalletCreatedEvent implements LedgerEvent {
    UUID eventId;
    UUID walletId;
    String label;
    Instant occurredAt;

    public static final String EVENT_TYPE = "WalletCreated";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static WalletCreatedEvent fromWallet(Wallet wallet) {
        return new WalletCreatedEvent(
            UUID.randomUUID(),
            wallet.getId(),
            wallet.getLabel(),
            wallet.getCreatedAt()
        );
    }
}

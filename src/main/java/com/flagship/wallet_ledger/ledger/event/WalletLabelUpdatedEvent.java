package com.flagship.wallet_ledger.ledger.event;

import com.flagship.wallet_ledger.wallet.Wallet;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class WalletLabelUpdatedEvent implements LedgerEvent {
    UUID eventId;
    UUID walletId;
    String previousLabel;
    String label;
    Instant occurredAt;

    public static final String EVENT_TYPE = "WalletLabelUpdated";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static WalletLabelUpdatedEvent of(String previousLabel, Wallet updated) {
        return new WalletLabelUpdatedEvent(
            UUID.randomUUID(),
            updated.getId(),
            previousLabel,
            updated.getLabel(),
            updated.getUpdatedAt()
        );
    }
}

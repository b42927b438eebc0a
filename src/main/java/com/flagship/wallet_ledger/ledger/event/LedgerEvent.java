package com.flagship.wallet_ledger.ledger.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Base interface for ledger events.
 *
 * Events are facts about a wallet that already happened. They are written to the
 * outbox in the same database transaction as the change they describe.
 */
public interface LedgerEvent {

    /**
     * Unique identifier for this event instance.
     * Used for deduplication in consumers.
     */
    UUID getEventId();

    /**
     * The wallet this event is about. Also used as the Kafka key.
     */
    UUID getWalletId();

    Instant getOccurredAt();

    /**
     * Event type name for routing/filtering.
     */
    String getEventType();
}

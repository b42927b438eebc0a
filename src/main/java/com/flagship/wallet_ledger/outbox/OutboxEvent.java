package com.flagship.wallet_ledger.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A ledger event waiting in (or already drained from) the outbox table.
 *
 * The row is written in the same database transaction as the wallet change, so
 * an event exists if and only if its change committed. Publishing to Kafka
 * happens later in {@link OutboxPublisher}.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;      // always "Wallet" today
    UUID aggregateId;          // wallet id, used as Kafka key
    String eventType;          // e.g. "TransactionApplied"
    String payload;            // JSON document
    Instant createdAt;
    Instant publishedAt;       // null until Kafka acknowledged it
    int retryCount;
    String lastError;
    Long sequenceNumber;       // assigned by the database

    public static OutboxEvent create(String aggregateType, UUID aggregateId,
                                     String eventType, String payload, Instant createdAt) {
        return new OutboxEvent(
            UUID.randomUUID(),
            aggregateType,
            aggregateId,
            eventType,
            payload,
            createdAt,
            null,
            0,
            null,
            null
        );
    }

    public boolean isPublished() {
        return publishedAt != null;
    }

    /**
     * True once the event failed often enough that the publisher stops trying.
     */
    public boolean isDeadLettered(int maxRetries) {
        return !isPublished() && retryCount >= maxRetries;
    }
}

package com.flagship.store_credit.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A pending, relayed or dead-lettered outbox row.
 *
 * aggregateType/aggregateId identify whose history the event belongs to
 * (for wallet audit: "Wallet" and the user id); the aggregate id doubles as
 * the Kafka key. correlationId ties together every event written by one
 * ledger operation or one expiry sweep.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;
    UUID aggregateId;
    String eventType;
    String correlationId;
    String payload;            // JSON
    Instant createdAt;
    Instant publishedAt;       // null while pending
    int retryCount;
    String lastError;
    Instant deadLetteredAt;    // set once the relay gives up
    Long sequenceNumber;

    public static OutboxEvent create(String aggregateType, UUID aggregateId, String eventType,
                                     String correlationId, String payload, Instant createdAt) {
        return new OutboxEvent(
            UUID.randomUUID(),
            aggregateType,
            aggregateId,
            eventType,
            correlationId,
            payload,
            createdAt,
            null,
            0,
            null,
            null,
            null   // assigned by the database
        );
    }

    public boolean isPublished() {
        return publishedAt != null;
    }

    public boolean isDeadLettered() {
        return deadLetteredAt != null;
    }
}

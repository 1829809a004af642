package com.flagship.store_credit.outbox;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA mapping of the outbox_events table.
 *
 * Rows are written once as pending and afterwards only move forward:
 * pending -> published, or pending -> dead-lettered after too many failed
 * sends. A dead-lettered row is kept for inspection and never relayed again.
 */
@Entity
@Table(name = "outbox_events")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class OutboxEventEntity {

    static final int MAX_ERROR_LENGTH = 1000;

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "aggregate_type", nullable = false, updatable = false, length = 100)
    private String aggregateType;

    @Column(name = "aggregate_id", nullable = false, updatable = false)
    private UUID aggregateId;

    @Column(name = "event_type", nullable = false, updatable = false, length = 100)
    private String eventType;

    @Column(name = "correlation_id", updatable = false, length = 100)
    private String correlationId;

    @Column(name = "payload", nullable = false, updatable = false, columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    private String payload;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "published_at")
    private Instant publishedAt;

    @Column(name = "retry_count", nullable = false)
    private int retryCount;

    @Column(name = "last_error", columnDefinition = "TEXT")
    private String lastError;

    @Column(name = "dead_lettered_at")
    private Instant deadLetteredAt;

    @Column(name = "sequence_number", insertable = false, updatable = false)
    private Long sequenceNumber;

    static OutboxEventEntity pending(OutboxEvent event) {
        if (event.isPublished() || event.isDeadLettered()) {
            throw new IllegalArgumentException("Outbox event " + event.getId() + " is not pending");
        }
        OutboxEventEntity entity = new OutboxEventEntity();
        entity.id = event.getId();
        entity.aggregateType = event.getAggregateType();
        entity.aggregateId = event.getAggregateId();
        entity.eventType = event.getEventType();
        entity.correlationId = event.getCorrelationId();
        entity.payload = event.getPayload();
        entity.createdAt = event.getCreatedAt();
        return entity;
    }

    public OutboxEvent toDomain() {
        return new OutboxEvent(id, aggregateType, aggregateId, eventType, correlationId, payload,
                createdAt, publishedAt, retryCount, lastError, deadLetteredAt, sequenceNumber);
    }

    void markPublished(Instant at) {
        if (deadLetteredAt != null) {
            throw new IllegalStateException("Outbox event " + id + " was dead-lettered at " + deadLetteredAt);
        }
        this.publishedAt = at;
        this.lastError = null;
    }

    /**
     * Records one failed send.
     *
     * @return true if this failure exhausted the retries and dead-lettered the row
     */
    boolean recordFailure(String errorMessage, int maxRetries, Instant at) {
        this.retryCount++;
        this.lastError = truncate(errorMessage);
        if (retryCount >= maxRetries && deadLetteredAt == null) {
            this.deadLetteredAt = at;
            return true;
        }
        return false;
    }

    private static String truncate(String message) {
        if (message == null || message.length() <= MAX_ERROR_LENGTH) {
            return message;
        }
        return message.substring(0, MAX_ERROR_LENGTH);
    }
}

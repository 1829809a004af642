package com.flagship.store_credit.outbox;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class OutboxEventEntityTest {

    private static final Instant CREATED = Instant.parse("2025-04-01T10:00:00Z");
    private static final Instant LATER = Instant.parse("2025-04-01T10:05:00Z");

    @Test
    @DisplayName("A new row is pending and keeps the audit correlation id")
    void pendingRow() {
        OutboxEventEntity entity = OutboxEventEntity.pending(event());

        OutboxEvent domain = entity.toDomain();
        assertEquals("sweep-42", domain.getCorrelationId());
        assertEquals(CREATED, domain.getCreatedAt());
        assertEquals(0, domain.getRetryCount());
        assertFalse(domain.isPublished());
        assertFalse(domain.isDeadLettered());
    }

    @Test
    @DisplayName("Failures below the limit only count; the failure that reaches it dead-letters the row once")
    void deadLettersOnLastAllowedFailure() {
        OutboxEventEntity entity = OutboxEventEntity.pending(event());

        assertFalse(entity.recordFailure("broker unavailable", 3, LATER));
        assertFalse(entity.recordFailure("broker unavailable", 3, LATER));
        assertTrue(entity.recordFailure("broker unavailable", 3, LATER));
        assertFalse(entity.recordFailure("broker unavailable", 3, LATER.plusSeconds(1)));

        assertEquals(4, entity.getRetryCount());
        assertEquals(LATER, entity.getDeadLetteredAt());
        assertTrue(entity.toDomain().isDeadLettered());
    }

    @Test
    void deadLetteredRowCannotBePublished() {
        OutboxEventEntity entity = OutboxEventEntity.pending(event());
        entity.recordFailure("broker unavailable", 1, LATER);

        assertThrows(IllegalStateException.class, () -> entity.markPublished(LATER));
        assertNull(entity.getPublishedAt());
    }

    @Test
    @DisplayName("Publishing clears the last error")
    void publishClearsError() {
        OutboxEventEntity entity = OutboxEventEntity.pending(event());
        entity.recordFailure("timeout", 5, LATER);

        entity.markPublished(LATER.plusSeconds(2));

        assertEquals(LATER.plusSeconds(2), entity.getPublishedAt());
        assertNull(entity.getLastError());
        assertEquals(1, entity.getRetryCount());
    }

    @Test
    void longErrorsAreTruncated() {
        OutboxEventEntity entity = OutboxEventEntity.pending(event());

        entity.recordFailure("x".repeat(5000), 5, LATER);

        assertEquals(OutboxEventEntity.MAX_ERROR_LENGTH, entity.getLastError().length());
    }

    @Test
    void onlyPendingEventsAreAccepted() {
        OutboxEvent published = new OutboxEvent(UUID.randomUUID(), "Wallet", UUID.randomUUID(), "credit_issued",
                null, "{}", CREATED, LATER, 0, null, null, 1L);

        assertThrows(IllegalArgumentException.class, () -> OutboxEventEntity.pending(published));
    }

    private static OutboxEvent event() {
        return OutboxEvent.create("Wallet", UUID.randomUUID(), "credit_expired", "sweep-42",
                "{\"action\":\"credit_expired\"}", CREATED);
    }
}

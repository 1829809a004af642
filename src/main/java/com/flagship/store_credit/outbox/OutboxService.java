package com.flagship.store_credit.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * Reads and writes the transactional outbox.
 *
 * Wallet audit events are written after the ledger unit has committed, so
 * {@link #saveEvent} joins a caller's transaction when there is one and
 * otherwise commits on its own. Publishing is left to {@link OutboxPublisher}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OutboxService {

    private final OutboxEventRepository repository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Serialises {@code payload} to JSON and stores it as a pending event.
     *
     * @throws IllegalArgumentException if the payload cannot be serialised
     */
    @Transactional
    public OutboxEvent saveEvent(String aggregateType, UUID aggregateId, String eventType,
                                 String correlationId, Object payload) {
        String jsonPayload = serializePayload(payload);

        OutboxEvent event = OutboxEvent.create(aggregateType, aggregateId, eventType,
                correlationId, jsonPayload, clock.instant());
        OutboxEventEntity saved = repository.save(OutboxEventEntity.pending(event));

        log.debug("Saved outbox event: type={}, aggregateType={}, aggregateId={}, correlationId={}",
                eventType, aggregateType, aggregateId, correlationId);

        return saved.toDomain();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public List<OutboxEvent> findPublishableEvents(int limit) {
        return repository.findPublishableForUpdate(limit)
                .stream()
                .map(OutboxEventEntity::toDomain)
                .toList();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markPublished(UUID eventId) {
        repository.findById(eventId).ifPresent(entity -> {
            entity.markPublished(clock.instant());
            repository.save(entity);
            log.debug("Marked event {} as published", eventId);
        });
    }

    /**
     * Records a failed publish attempt.
     *
     * @return true if the event has now used up {@code maxRetries} and is dead-lettered
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean markFailed(UUID eventId, String errorMessage, int maxRetries) {
        return repository.findById(eventId)
                .map(entity -> {
                    boolean deadLettered = entity.recordFailure(errorMessage, maxRetries, clock.instant());
                    repository.save(entity);
                    log.warn("Marked event {} as failed (retry #{}): {}",
                            eventId, entity.getRetryCount(), errorMessage);
                    return deadLettered;
                })
                .orElse(false);
    }

    /**
     * Audit trail of one aggregate, in write order.
     */
    @Transactional(readOnly = true)
    public List<OutboxEvent> getEventsForAggregate(String aggregateType, UUID aggregateId) {
        return repository.findByAggregateTypeAndAggregateIdOrderBySequenceNumberAsc(
                aggregateType, aggregateId)
                .stream()
                .map(OutboxEventEntity::toDomain)
                .toList();
    }

    /**
     * Every event written under one correlation id, e.g. all expiries of one sweep.
     */
    @Transactional(readOnly = true)
    public List<OutboxEvent> getEventsForCorrelation(String correlationId) {
        return repository.findByCorrelationIdOrderBySequenceNumberAsc(correlationId)
                .stream()
                .map(OutboxEventEntity::toDomain)
                .toList();
    }

    @Transactional(readOnly = true)
    public long countUnpublished() {
        return repository.countUnpublished();
    }

    private String serializePayload(Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize event payload", e);
        }
    }
}

package com.flagship.store_credit.outbox;

import com.flagship.store_credit.observability.OutboxMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Relay behaviour of the outbox publisher with Kafka and the outbox table mocked.
 */
@ExtendWith(MockitoExtension.class)
class OutboxPublisherTest {

    private static final String TOPIC = "wallet-audit";

    @Mock
    private OutboxService outboxService;

    @Mock
    private KafkaTemplate<String, String> kafkaTemplate;

    @Mock
    private OutboxEventRepository outboxRepository;

    private SimpleMeterRegistry registry;
    private OutboxPublisher publisher;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        publisher = new OutboxPublisher(outboxService, kafkaTemplate, new OutboxMetrics(outboxRepository, registry));
        ReflectionTestUtils.setField(publisher, "auditTopic", TOPIC);
        ReflectionTestUtils.setField(publisher, "batchSize", 100);
        ReflectionTestUtils.setField(publisher, "maxRetries", 3);
    }

    @Test
    @DisplayName("Published events are keyed by user and marked published")
    void publishesKeyedByUser() {
        OutboxEvent event = pending(0);
        when(outboxService.findPublishableEvents(100)).thenReturn(List.of(event));
        when(kafkaTemplate.send(TOPIC, event.getAggregateId().toString(), event.getPayload()))
                .thenReturn(CompletableFuture.completedFuture(sent(event)));

        publisher.publishPendingEvents();

        verify(outboxService).markPublished(event.getId());
        verify(outboxService, never()).markFailed(eq(event.getId()), anyString(), anyInt());
        assertEquals(1.0, registry.get("outbox.events.published")
                .tag("event_type", "credit_issued").tag("status", "success").counter().count());
    }

    @Test
    @DisplayName("A failed send is counted as a retry")
    void failedSendIsRetried() {
        OutboxEvent event = pending(0);
        when(outboxService.findPublishableEvents(100)).thenReturn(List.of(event));
        when(kafkaTemplate.send(TOPIC, event.getAggregateId().toString(), event.getPayload()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker unavailable")));
        when(outboxService.markFailed(eq(event.getId()), anyString(), eq(3))).thenReturn(false);

        publisher.publishPendingEvents();

        verify(outboxService, never()).markPublished(event.getId());
        assertTrue(registry.find("outbox.events.dead_lettered").counters().isEmpty());
    }

    @Test
    @DisplayName("The last allowed failure dead-letters the event")
    void deadLettersAfterMaxRetries() {
        OutboxEvent event = pending(2);
        when(outboxService.findPublishableEvents(100)).thenReturn(List.of(event));
        when(kafkaTemplate.send(TOPIC, event.getAggregateId().toString(), event.getPayload()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker unavailable")));
        when(outboxService.markFailed(eq(event.getId()), anyString(), eq(3))).thenReturn(true);

        publisher.publishPendingEvents();

        assertEquals(1.0, registry.get("outbox.events.dead_lettered")
                .tag("event_type", "credit_issued").counter().count());
    }

    @Test
    @DisplayName("An outbox read failure does not escape the polling loop")
    void pollingFailureIsContained() {
        when(outboxService.findPublishableEvents(100)).thenThrow(new IllegalStateException("database down"));

        assertDoesNotThrow(() -> publisher.publishPendingEvents());
    }

    private OutboxEvent pending(int retryCount) {
        return new OutboxEvent(UUID.randomUUID(), "Wallet", UUID.randomUUID(), "credit_issued", "corr-1",
                "{\"action\":\"credit_issued\"}", Instant.now(), null, retryCount, null, null, 1L);
    }

    private SendResult<String, String> sent(OutboxEvent event) {
        ProducerRecord<String, String> record =
                new ProducerRecord<>(TOPIC, event.getAggregateId().toString(), event.getPayload());
        RecordMetadata metadata = new RecordMetadata(new TopicPartition(TOPIC, 0), 0L, 0, 0L, 0, 0);
        return new SendResult<>(record, metadata);
    }
}

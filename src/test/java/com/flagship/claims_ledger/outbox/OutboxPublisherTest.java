package com.flagship.claims_ledger.outbox;

import com.flagship.claims_ledger.observability.OutboxMetrics;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Outbox polling against a mocked Kafka template.
 */
@SuppressWarnings("unchecked")
class OutboxPublisherTest {

    private OutboxService outboxService;
    private KafkaTemplate<String, String> kafkaTemplate;
    private OutboxMetrics outboxMetrics;
    private OutboxPublisher publisher;

    @BeforeEach
    void setUp() {
        outboxService = mock(OutboxService.class);
        kafkaTemplate = mock(KafkaTemplate.class);
        outboxMetrics = mock(OutboxMetrics.class);
        publisher = new OutboxPublisher(outboxService, kafkaTemplate, outboxMetrics);
        ReflectionTestUtils.setField(publisher, "claimsTopic", "claims");
        ReflectionTestUtils.setField(publisher, "batchSize", 100);
        ReflectionTestUtils.setField(publisher, "maxRetries", 3);
        ReflectionTestUtils.setField(publisher, "sendTimeoutMs", 1000L);
    }

    @Test
    @DisplayName("Sent events are keyed by vault id and marked published")
    void publishesKeyedByVault() {
        UUID vaultId = UUID.randomUUID();
        OutboxEvent event = event(vaultId, "ClaimsCreated", 0);
        when(outboxService.findUnpublishedEvents(3, 100)).thenReturn(List.of(event));
        when(kafkaTemplate.send("claims", vaultId.toString(), event.getPayload()))
            .thenReturn(CompletableFuture.completedFuture(sendResult(vaultId, event.getPayload())));

        publisher.publishPendingEvents();

        verify(outboxService).markPublished(event.getId());
        verify(outboxMetrics).recordEventPublished("ClaimsCreated");
        verify(outboxService, never()).markFailed(eq(event.getId()), anyString());
    }

    @Test
    @DisplayName("A failed send increments the retry count and stays unpublished")
    void failedSendMarksFailed() {
        UUID vaultId = UUID.randomUUID();
        OutboxEvent event = event(vaultId, "ClaimsSettled", 0);
        when(outboxService.findUnpublishedEvents(3, 100)).thenReturn(List.of(event));
        when(kafkaTemplate.send(anyString(), anyString(), anyString()))
            .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker down")));

        publisher.publishPendingEvents();

        verify(outboxService).markFailed(eq(event.getId()), anyString());
        verify(outboxService, never()).markPublished(event.getId());
        verify(outboxMetrics).recordEventPublishFailed("ClaimsSettled");
        verify(outboxMetrics, never()).recordEventDeadLettered(anyString());
    }

    @Test
    @DisplayName("The last allowed failure counts the event as dead-lettered")
    void lastFailureDeadLetters() {
        OutboxEvent event = event(UUID.randomUUID(), "ClaimsFailed", 2);
        when(outboxService.findUnpublishedEvents(3, 100)).thenReturn(List.of(event));
        when(kafkaTemplate.send(anyString(), anyString(), anyString()))
            .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker down")));

        publisher.publishPendingEvents();

        verify(outboxMetrics).recordEventDeadLettered("ClaimsFailed");
    }

    @Test
    @DisplayName("An empty outbox sends nothing")
    void emptyOutbox() {
        when(outboxService.findUnpublishedEvents(anyInt(), anyInt())).thenReturn(List.of());

        publisher.publishPendingEvents();

        verify(kafkaTemplate, never()).send(anyString(), anyString(), anyString());
    }

    private OutboxEvent event(UUID vaultId, String type, int retryCount) {
        return new OutboxEvent(UUID.randomUUID(), OutboxService.VAULT_AGGREGATE, vaultId, type,
            "{\"eventType\":\"" + type + "\"}", Instant.now(), null, retryCount, null);
    }

    private SendResult<String, String> sendResult(UUID vaultId, String payload) {
        return new SendResult<>(
            new ProducerRecord<>("claims", vaultId.toString(), payload),
            new RecordMetadata(new TopicPartition("claims", 0), 0L, 0, System.currentTimeMillis(), 36, payload.length()));
    }
}

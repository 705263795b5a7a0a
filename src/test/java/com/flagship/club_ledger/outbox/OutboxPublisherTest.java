package com.flagship.club_ledger.outbox;

import com.flagship.club_ledger.observability.OutboxMetrics;
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

import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Publisher bookkeeping with the broker mocked out.
 */
@ExtendWith(MockitoExtension.class)
class OutboxPublisherTest {

    @Mock
    private OutboxService outboxService;

    @Mock
    private KafkaTemplate<String, String> kafkaTemplate;

    @Mock
    private OutboxMetrics outboxMetrics;

    private OutboxPublisher publisher;

    @BeforeEach
    void setUp() {
        publisher = new OutboxPublisher(outboxService, kafkaTemplate, outboxMetrics);
        ReflectionTestUtils.setField(publisher, "receiptsTopic", "receipts");
        ReflectionTestUtils.setField(publisher, "batchSize", 10);
    }

    private static OutboxEvent receipt(UUID transactionId) {
        return OutboxEvent.create(OutboxPublisher.RECEIPT_AGGREGATE, transactionId,
                "PaymentReceipt", "{\"amount\":5000}");
    }

    @Test
    @DisplayName("Sent messages are keyed by transaction id and marked published")
    void testPublishSuccess() {
        UUID transactionId = UUID.randomUUID();
        OutboxEvent event = receipt(transactionId);
        when(outboxService.findUnpublishedEvents(anyInt())).thenReturn(List.of(event));

        RecordMetadata metadata = new RecordMetadata(new TopicPartition("receipts", 0), 0, 0, 0, 0, 0);
        SendResult<String, String> result = new SendResult<>(
                new ProducerRecord<>("receipts", transactionId.toString(), event.getPayload()), metadata);
        when(kafkaTemplate.send("receipts", transactionId.toString(), event.getPayload()))
                .thenReturn(CompletableFuture.completedFuture(result));

        publisher.publishPendingEvents();

        verify(outboxService).markPublished(event.getId());
        verify(outboxMetrics).recordEventPublished("PaymentReceipt");
        verify(outboxService, never()).markFailed(eq(event.getId()), anyString());
    }

    @Test
    @DisplayName("Broker failures are recorded against the message")
    void testPublishFailure() {
        OutboxEvent event = receipt(UUID.randomUUID());
        when(outboxService.findUnpublishedEvents(anyInt())).thenReturn(List.of(event));
        when(kafkaTemplate.send(anyString(), anyString(), anyString()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker down")));

        publisher.publishPendingEvents();

        verify(outboxService).markFailed(eq(event.getId()), anyString());
        verify(outboxMetrics).recordEventPublishFailed("PaymentReceipt");
        verify(outboxService, never()).markPublished(event.getId());
    }
}

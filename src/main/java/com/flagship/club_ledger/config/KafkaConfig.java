package com.flagship.club_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Kafka topics written by the outbox publisher.
 *
 * Receipt notifications are the only outbound traffic; the mail/SMS service
 * that consumes them lives outside this repository.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.receipts:receipts}")
    private String receiptsTopic;

    @Value("${kafka.topic.partitions:3}")
    private int partitions;

    @Bean
    public NewTopic receiptsTopic() {
        return TopicBuilder.name(receiptsTopic)
                .partitions(partitions)
                .replicas(1)
                .build();
    }
}

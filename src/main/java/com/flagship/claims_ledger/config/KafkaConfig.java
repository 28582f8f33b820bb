package com.flagship.claims_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Declares the claims event topic. Events are keyed by vault id, so one vault's events stay ordered.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.claims:claims}")
    private String claimsTopic;

    @Value("${kafka.topic.claims-partitions:3}")
    private int partitions;

    @Bean
    public NewTopic claimsTopic() {
        return TopicBuilder.name(claimsTopic)
                .partitions(partitions)
                .replicas(1)
                .build();
    }
}

package com.flagship.toy_banking.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Kafka configuration for transfer lifecycle events.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.transfers:transfers}")
    private String transfersTopic;

    /**
     * Creates the transfers topic if it doesn't exist.
     * Keyed by transfer id, so 3 partitions keep per-transfer ordering.
     */
    @Bean
    public NewTopic transfersTopic() {
        return TopicBuilder.name(transfersTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }
}

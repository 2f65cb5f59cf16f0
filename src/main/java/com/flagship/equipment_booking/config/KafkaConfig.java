package com.flagship.equipment_booking.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Kafka configuration for the change-history stream.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.inventory-changes:inventory-changes}")
    private String inventoryChangesTopic;

    /**
     * Creates the inventory-changes topic if it doesn't exist.
     * Entity ids are used as keys, so 3 partitions keep per-entity ordering.
     */
    @Bean
    public NewTopic inventoryChangesTopic() {
        return TopicBuilder.name(inventoryChangesTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }
}

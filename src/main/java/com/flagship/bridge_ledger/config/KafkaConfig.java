package com.flagship.bridge_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Kafka topic for inbound tracked events.
 *
 * Producers key records by customer id so one customer's events stay in one partition.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.tracked-events:tracked-events}")
    private String trackedEventsTopic;

    @Bean
    public NewTopic trackedEventsTopic() {
        return TopicBuilder.name(trackedEventsTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }
}

package com.flagship.trade_finance.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Kafka topic for shipment events.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.shipments:shipments}")
    private String shipmentsTopic;

    /**
     * Events are keyed by shipment hash, so partitions preserve per-shipment order.
     */
    @Bean
    public NewTopic shipmentsTopic() {
        return TopicBuilder.name(shipmentsTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }
}

package com.flagship.budget_reconciliation.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Topics for record-changed notifications.
 *
 * DetailItem changes get their own topic because they drive reconciliation;
 * all other kinds share the records topic.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.detail-items:budget.detail-items}")
    private String detailItemsTopic;

    @Value("${kafka.topic.records:budget.records}")
    private String recordsTopic;

    @Value("${kafka.topic.partitions:3}")
    private int partitions;

    @Bean
    public NewTopic detailItemsTopic() {
        return TopicBuilder.name(detailItemsTopic)
            .partitions(partitions)
            .replicas(1)
            .build();
    }

    @Bean
    public NewTopic recordsTopic() {
        return TopicBuilder.name(recordsTopic)
            .partitions(partitions)
            .replicas(1)
            .build();
    }
}

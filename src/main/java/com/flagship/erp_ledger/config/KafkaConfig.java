package com.flagship.erp_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.postings:erp.ledger.postings}")
    private String postingsTopic;

    @Value("${kafka.topic.partitions:3}")
    private int partitions;

    @Value("${kafka.topic.replicas:1}")
    private int replicas;

    /**
     * Topic for ledger posting events, keyed by document id so events of one document stay ordered.
     */
    @Bean
    @ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
    public NewTopic postingsTopic() {
        return TopicBuilder.name(postingsTopic)
                .partitions(partitions)
                .replicas(replicas)
                .build();
    }
}

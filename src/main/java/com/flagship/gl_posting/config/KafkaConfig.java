package com.flagship.gl_posting.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Topics the outbox publisher writes to. Journal events are keyed by journal id,
 * so one entry's events stay ordered within a partition.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.journals:gl-journals}")
    private String journalsTopic;

    @Value("${kafka.topic.audit:gl-posting-audit}")
    private String auditTopic;

    @Bean
    public NewTopic journalsTopic() {
        return TopicBuilder.name(journalsTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }

    @Bean
    public NewTopic auditTopic() {
        return TopicBuilder.name(auditTopic)
                .partitions(1)
                .replicas(1)
                .build();
    }
}

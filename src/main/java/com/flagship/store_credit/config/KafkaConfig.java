package com.flagship.store_credit.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

@Configuration
public class KafkaConfig {

    @Value("${wallet.topic.audit:wallet-audit}")
    private String auditTopic;

    /**
     * Audit topic, partitioned by user id.
     */
    @Bean
    public NewTopic walletAuditTopic() {
        return TopicBuilder.name(auditTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }
}

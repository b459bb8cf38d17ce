package io.malicki.transferpipeline.kafka.config;

import io.malicki.transferpipeline.config.TransferProperties;
import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

@Configuration
public class KafkaTopicsConfig {

    private static final String RETENTION_30_DAYS = "2592000000";

    @Bean
    public NewTopic transferLifecycleTopic(TransferProperties properties) {
        return TopicBuilder.name(properties.getLifecycleTopic())
            .partitions(3)
            .replicas(1)
            .config("retention.ms", RETENTION_30_DAYS)
            .build();
    }
}

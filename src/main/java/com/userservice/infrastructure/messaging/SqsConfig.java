package com.userservice.infrastructure.messaging;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(SqsProperties.class)
public class SqsConfig {

    /**
     * Fails startup with a {@code CONFIG_INVALID} error if the queues cannot be resolved.
     */
    @Bean
    public SqsQueueClient sqsQueueClient(SqsProperties properties) {
        return new QueueEndpointResolver().resolve(properties);
    }
}

package com.userservice.infrastructure.messaging;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Queue settings bound from {@code app.sqs.*}.
 *
 * {@code queueNames} maps logical keys (see {@link com.userservice.domain.model.QueueKey})
 * to physical queue names.
 */
@Data
@ConfigurationProperties(prefix = "app.sqs")
public class SqsProperties {

    private String environment;
    private String region;
    private String endpoint;
    private Map<String, String> queueNames = new LinkedHashMap<>();
}

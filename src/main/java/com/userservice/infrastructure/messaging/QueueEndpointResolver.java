package com.userservice.infrastructure.messaging;

import com.userservice.domain.exception.ErrorCode;
import com.userservice.domain.exception.ServiceException;
import com.userservice.domain.model.QueueKey;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.sqs.SqsClient;

import java.net.URI;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * Resolves logical queue keys to queue URLs and builds the SQS client.
 *
 * <p>Only the {@code local} and {@code test} environments are resolved here. They
 * need an explicit endpoint (LocalStack or similar) and derive each URL as
 * {@code {endpoint}/000000000000/{queueName}} without calling the queue service.
 * Every other environment is rejected; production lookup through
 * {@code GetQueueUrl} belongs to the deployment, not to this service.</p>
 *
 * <p>Any failing entry fails the whole resolution. No partial map is returned.</p>
 */
@Slf4j
public class QueueEndpointResolver {

    static final String LOCAL_ACCOUNT_ID = "000000000000";

    private static final Set<String> LOCAL_ENVIRONMENTS = Set.of("local", "test");

    public SqsQueueClient resolve(SqsProperties properties) {
        String environment = properties.getEnvironment();
        if (environment == null || !LOCAL_ENVIRONMENTS.contains(environment)) {
            throw new ServiceException(ErrorCode.CONFIG_INVALID, "invalid environment: " + environment);
        }
        String endpoint = properties.getEndpoint();
        if (endpoint == null || endpoint.isBlank()) {
            throw new ServiceException(ErrorCode.CONFIG_INVALID,
                    "SQS endpoint is required for local/test environment");
        }
        if (properties.getRegion() == null || properties.getRegion().isBlank()) {
            throw new ServiceException(ErrorCode.CONFIG_INVALID, "SQS region is required");
        }

        URI endpointUri;
        try {
            endpointUri = URI.create(endpoint);
        } catch (IllegalArgumentException e) {
            throw new ServiceException(ErrorCode.CONFIG_INVALID, "invalid SQS endpoint: " + endpoint, e);
        }

        Map<QueueKey, String> queueUrls = new EnumMap<>(QueueKey.class);
        for (Map.Entry<String, String> entry : properties.getQueueNames().entrySet()) {
            QueueKey key = toQueueKey(entry.getKey());
            String queueName = entry.getValue();
            if (queueName == null || queueName.isBlank()) {
                throw new ServiceException(ErrorCode.CONFIG_INVALID, "queue name is empty for key " + entry.getKey());
            }
            queueUrls.put(key, String.format("%s/%s/%s", endpoint, LOCAL_ACCOUNT_ID, queueName));
        }

        SqsClient client = SqsClient.builder()
                .region(Region.of(properties.getRegion()))
                .endpointOverride(endpointUri)
                .build();

        log.info("Resolved {} SQS queue(s) for environment {}: {}", queueUrls.size(), environment, queueUrls);
        return new SqsQueueClient(client, Collections.unmodifiableMap(queueUrls));
    }

    private static QueueKey toQueueKey(String key) {
        try {
            return QueueKey.fromKey(key);
        } catch (IllegalArgumentException e) {
            throw new ServiceException(ErrorCode.CONFIG_INVALID, e.getMessage(), e);
        }
    }
}

package com.userservice.infrastructure.messaging;

import com.userservice.domain.exception.ErrorCode;
import com.userservice.domain.exception.ServiceException;
import com.userservice.domain.model.QueueKey;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import software.amazon.awssdk.services.sqs.SqsClient;

import java.util.Map;

/**
 * An SQS client together with the resolved queue URLs. Built once at startup
 * and read-only afterwards, so it is shared across threads without locking.
 */
@Getter
@RequiredArgsConstructor
public class SqsQueueClient implements AutoCloseable {

    private final SqsClient client;
    private final Map<QueueKey, String> queueUrls;

    public String queueUrl(QueueKey key) {
        String url = queueUrls.get(key);
        if (url == null) {
            throw new ServiceException(ErrorCode.CONFIG_INVALID, "No queue URL resolved for key " + key.getKey());
        }
        return url;
    }

    @Override
    public void close() {
        client.close();
    }
}

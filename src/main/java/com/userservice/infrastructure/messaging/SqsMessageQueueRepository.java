package com.userservice.infrastructure.messaging;

import com.userservice.domain.exception.ErrorCode;
import com.userservice.domain.exception.ServiceException;
import com.userservice.domain.model.QueueKey;
import com.userservice.domain.model.QueueMessage;
import com.userservice.domain.repository.MessageQueueRepository;
import com.userservice.domain.repository.ReceiveMessageOptions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.sqs.SqsClient;
import software.amazon.awssdk.services.sqs.model.DeleteMessageRequest;
import software.amazon.awssdk.services.sqs.model.ReceiveMessageRequest;
import software.amazon.awssdk.services.sqs.model.ReceiveMessageResponse;
import software.amazon.awssdk.services.sqs.model.SendMessageRequest;

import java.util.List;

/**
 * {@link MessageQueueRepository} over the {@code sample} SQS queue.
 */
@Slf4j
@Repository
public class SqsMessageQueueRepository implements MessageQueueRepository {

    // SQS caps a single receive at 10 messages
    private static final int MAX_BATCH = 10;

    private final SqsClient client;
    private final String queueUrl;

    public SqsMessageQueueRepository(SqsQueueClient sqsQueueClient) {
        this.client = sqsQueueClient.getClient();
        this.queueUrl = sqsQueueClient.queueUrl(QueueKey.SAMPLE);
    }

    @Override
    public void sendMessage(QueueMessage message) {
        try {
            client.sendMessage(SendMessageRequest.builder()
                    .queueUrl(queueUrl)
                    .messageBody(message.getBody())
                    .build());
        } catch (SdkException e) {
            throw new ServiceException(ErrorCode.QUEUE_UNAVAILABLE, "Failed to send message to " + queueUrl, e);
        }
    }

    @Override
    public List<QueueMessage> receiveMessage(ReceiveMessageOptions options) {
        int max = options.getMaxNumberOfMessages();
        if (max < 1 || max > MAX_BATCH) {
            throw new ServiceException(ErrorCode.VALIDATION_FAILED,
                    "maxNumberOfMessages must be between 1 and " + MAX_BATCH + ": " + max);
        }
        try {
            ReceiveMessageResponse response = client.receiveMessage(ReceiveMessageRequest.builder()
                    .queueUrl(queueUrl)
                    .maxNumberOfMessages(max)
                    .waitTimeSeconds(options.getWaitTimeSeconds())
                    .build());
            log.debug("Received {} message(s) from {}", response.messages().size(), queueUrl);
            return response.messages().stream()
                    .map(m -> QueueMessage.builder()
                            .body(m.body())
                            .receiptHandle(m.receiptHandle())
                            .build())
                    .toList();
        } catch (SdkException e) {
            throw new ServiceException(ErrorCode.QUEUE_UNAVAILABLE, "Failed to receive from " + queueUrl, e);
        }
    }

    @Override
    public void deleteMessage(String receiptHandle) {
        try {
            client.deleteMessage(DeleteMessageRequest.builder()
                    .queueUrl(queueUrl)
                    .receiptHandle(receiptHandle)
                    .build());
        } catch (SdkException e) {
            throw new ServiceException(ErrorCode.QUEUE_ACK_FAILED, "Failed to delete message from " + queueUrl, e);
        }
    }
}

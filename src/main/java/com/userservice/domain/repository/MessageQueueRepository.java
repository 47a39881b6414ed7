package com.userservice.domain.repository;

import com.userservice.domain.model.QueueMessage;

import java.util.List;

/**
 * At-least-once queue: a received message is leased, not removed, and comes
 * back after the lease expires unless it is deleted with its receipt handle.
 */
public interface MessageQueueRepository {

    void sendMessage(QueueMessage message);

    /**
     * Bounded poll. Returns an empty list when nothing is visible.
     */
    List<QueueMessage> receiveMessage(ReceiveMessageOptions options);

    void deleteMessage(String receiptHandle);
}

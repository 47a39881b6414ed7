package com.userservice.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A message on a durable queue.
 *
 * {@code receiptHandle} is only set on received messages and is valid for the
 * visibility lease the queue granted on that delivery.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueueMessage {

    private String body;
    private String receiptHandle;

    public static QueueMessage of(String body) {
        return QueueMessage.builder().body(body).build();
    }
}

package com.userservice.domain.repository;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ReceiveMessageOptions {

    @Builder.Default
    int maxNumberOfMessages = 1;

    /**
     * Long-poll wait; zero returns immediately.
     */
    @Builder.Default
    int waitTimeSeconds = 0;
}

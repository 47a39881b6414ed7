package com.userservice.domain.port;

import lombok.Value;

import java.util.UUID;

@Value
public class ProcessMessageInput {

    private static final UUID NIL = new UUID(0L, 0L);

    UUID id;

    /**
     * Input carrying the nil UUID, used by the background subscriber.
     */
    public static ProcessMessageInput empty() {
        return new ProcessMessageInput(NIL);
    }
}

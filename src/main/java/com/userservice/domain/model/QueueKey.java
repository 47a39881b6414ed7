package com.userservice.domain.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Logical queue names. Physical addresses are resolved once at startup.
 */
@Getter
@RequiredArgsConstructor
public enum QueueKey {

    SAMPLE("sample");

    private final String key;

    public static QueueKey fromKey(String key) {
        for (QueueKey queueKey : values()) {
            if (queueKey.key.equals(key)) {
                return queueKey;
            }
        }
        throw new IllegalArgumentException("Unknown queue key: " + key);
    }
}

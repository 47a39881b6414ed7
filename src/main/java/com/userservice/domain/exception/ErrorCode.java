package com.userservice.domain.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Failure categories surfaced by the service core.
 *
 * <p>{@code retryable} marks the categories that may resolve on their own
 * (queue or store outages). The subscriber loop logs the others as rejected
 * messages rather than errors.</p>
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    VALIDATION_FAILED("Invalid input value", false),
    USER_NOT_FOUND("User not found", false),
    MATCH_NOT_FOUND("Match not found", false),
    PERSISTENCE_FAILED("Primary store operation failed", true),
    CONFIG_INVALID("Invalid configuration", false),
    CACHE_FAILED("Cache operation failed", true),
    QUEUE_ACK_FAILED("Queue message acknowledgement failed", true),
    QUEUE_UNAVAILABLE("Queue send or receive failed", true),
    MESSAGE_MALFORMED("Queue message body could not be decoded", false);

    private final String message;
    private final boolean retryable;
}

package com.userservice.domain.port;

import lombok.Value;

import java.util.UUID;

/**
 * Identifier of a deleted user or match.
 */
@Value
public class DeleteOutput {
    UUID id;
}

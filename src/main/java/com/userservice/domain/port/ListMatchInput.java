package com.userservice.domain.port;

import lombok.Value;

import java.util.UUID;

@Value
public class ListMatchInput {
    UUID userId;
    int limit;
    int offset;
}

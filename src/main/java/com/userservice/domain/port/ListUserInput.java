package com.userservice.domain.port;

import lombok.Value;

@Value
public class ListUserInput {
    int limit;
    int offset;
}

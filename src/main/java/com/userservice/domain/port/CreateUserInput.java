package com.userservice.domain.port;

import lombok.Value;

@Value
public class CreateUserInput {
    String email;
}

package com.userservice.domain.port;

import lombok.Value;

import java.util.UUID;

@Value
public class CreateMatchInput {
    UUID meId;
    UUID partnerId;
}

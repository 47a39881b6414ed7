package com.userservice.domain.port;

import com.userservice.domain.model.MatchStatus;
import lombok.Value;

import java.util.UUID;

@Value
public class UpdateMatchInput {
    UUID id;
    MatchStatus status;
}

package com.userservice.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * A match request from one user ({@code meId}) to another ({@code partnerId}).
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Match {

    private UUID id;
    private UUID meId;
    private UUID partnerId;
    private MatchStatus status;
    private Instant createdAt;
    private Instant updatedAt;
}

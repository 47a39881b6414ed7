package com.userservice.domain.model;

public enum MatchStatus {
    PENDING,
    ACCEPTED,
    REJECTED
}

package com.userservice.domain.repository;

import com.userservice.domain.model.User;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Key-value cache of user snapshots keyed by id.
 *
 * Every method may throw a {@code ServiceException} with {@code CACHE_FAILED};
 * callers treat the cache as an optimization and downgrade that to a log entry.
 */
public interface UserCacheRepository {

    void store(User user, Duration ttl);

    Optional<User> findById(UUID id);

    void remove(UUID id);
}

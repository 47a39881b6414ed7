package com.userservice.infrastructure.cache;

import com.userservice.domain.exception.ErrorCode;
import com.userservice.domain.exception.ServiceException;
import com.userservice.domain.model.User;
import com.userservice.domain.repository.UserCacheRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.SerializationException;
import org.springframework.stereotype.Repository;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * User cache in Redis under {@code user:{id}}. Every write carries its own TTL.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class RedisUserCacheRepository implements UserCacheRepository {

    static final String KEY_PREFIX = "user:";

    private final RedisTemplate<String, User> userRedisTemplate;

    @Override
    public void store(User user, Duration ttl) {
        if (user.getId() == null) {
            throw new ServiceException(ErrorCode.CACHE_FAILED, "Cannot cache a user without id");
        }
        try {
            userRedisTemplate.opsForValue().set(key(user.getId()), user, ttl);
        } catch (DataAccessException | SerializationException e) {
            throw new ServiceException(ErrorCode.CACHE_FAILED, "Failed to cache user " + user.getId(), e);
        }
    }

    @Override
    public Optional<User> findById(UUID id) {
        try {
            return Optional.ofNullable(userRedisTemplate.opsForValue().get(key(id)));
        } catch (DataAccessException | SerializationException e) {
            throw new ServiceException(ErrorCode.CACHE_FAILED, "Failed to read cached user " + id, e);
        }
    }

    @Override
    public void remove(UUID id) {
        try {
            Boolean deleted = userRedisTemplate.delete(key(id));
            log.debug("Evicted user {} from cache: {}", id, deleted);
        } catch (DataAccessException e) {
            throw new ServiceException(ErrorCode.CACHE_FAILED, "Failed to evict user " + id, e);
        }
    }

    static String key(UUID id) {
        return KEY_PREFIX + id;
    }
}

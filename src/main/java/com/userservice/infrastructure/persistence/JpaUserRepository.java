package com.userservice.infrastructure.persistence;

import com.userservice.domain.exception.ErrorCode;
import com.userservice.domain.exception.ServiceException;
import com.userservice.domain.model.User;
import com.userservice.domain.repository.UserRepository;
import com.userservice.infrastructure.persistence.entity.UserEntity;
import com.userservice.infrastructure.persistence.repository.UserJpaRepository;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceException;
import jakarta.persistence.PersistenceContext;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

/**
 * {@link UserRepository} over Spring Data JPA.
 *
 * Writes rely on the caller's transaction. Reads outside a transaction translate
 * store failures to {@code PERSISTENCE_FAILED} themselves.
 */
@Repository
@RequiredArgsConstructor
public class JpaUserRepository implements UserRepository {

    private final UserJpaRepository jpaRepository;

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    public User save(User user) {
        if (user.getId() == null) {
            UserEntity entity = UserEntity.builder()
                    .email(user.getEmail())
                    .build();
            return toDomain(jpaRepository.save(entity));
        }

        UserEntity entity = jpaRepository.findById(user.getId())
                .orElseThrow(() -> notFound(user.getId()));
        entity.setEmail(user.getEmail());
        entity.touch();
        return toDomain(entity);
    }

    @Override
    public User findById(UUID id) {
        try {
            return jpaRepository.findById(id)
                    .map(JpaUserRepository::toDomain)
                    .orElseThrow(() -> notFound(id));
        } catch (DataAccessException | PersistenceException e) {
            throw new ServiceException(ErrorCode.PERSISTENCE_FAILED, "Failed to load user " + id, e);
        }
    }

    @Override
    public List<User> findAll(int limit, int offset) {
        try {
            return entityManager
                    .createQuery("select u from UserEntity u order by u.createdAt, u.id", UserEntity.class)
                    .setFirstResult(offset)
                    .setMaxResults(limit)
                    .getResultList()
                    .stream()
                    .map(JpaUserRepository::toDomain)
                    .toList();
        } catch (DataAccessException | PersistenceException e) {
            throw new ServiceException(ErrorCode.PERSISTENCE_FAILED, "Failed to list users", e);
        }
    }

    @Override
    public UUID remove(UUID id) {
        UserEntity entity = jpaRepository.findById(id)
                .orElseThrow(() -> notFound(id));
        jpaRepository.delete(entity);
        return entity.getId();
    }

    static User toDomain(UserEntity entity) {
        return User.builder()
                .id(entity.getId())
                .email(entity.getEmail())
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .build();
    }

    private static ServiceException notFound(UUID id) {
        return new ServiceException(ErrorCode.USER_NOT_FOUND, "User not found: " + id);
    }
}

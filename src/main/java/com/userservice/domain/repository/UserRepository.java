package com.userservice.domain.repository;

import com.userservice.domain.model.User;

import java.util.List;
import java.util.UUID;

/**
 * Primary store for users.
 *
 * {@link #save} and {@link #remove} must run inside a unit of work opened by
 * {@link com.userservice.domain.transaction.TransactionManager#doInTx}.
 */
public interface UserRepository {

    /**
     * Inserts a user without an id, or updates the email of an existing one.
     *
     * @return the persisted user with store-assigned id and timestamps
     */
    User save(User user);

    /**
     * @throws com.userservice.domain.exception.ServiceException with
     *         {@code USER_NOT_FOUND} if no user has this id
     */
    User findById(UUID id);

    List<User> findAll(int limit, int offset);

    /**
     * @return the removed id
     * @throws com.userservice.domain.exception.ServiceException with
     *         {@code USER_NOT_FOUND} if no user has this id
     */
    UUID remove(UUID id);
}

package com.userservice.domain.transaction;

/**
 * An open unit of work. Exactly one of {@link #commit()} or {@link #rollback()}
 * takes effect; {@link #close()} rolls back if neither has.
 */
public interface TransactionHandle extends AutoCloseable {

    void commit();

    void rollback();

    boolean isCompleted();

    /**
     * Rolls back an uncompleted transaction. Rollback failures are logged, not thrown.
     */
    @Override
    void close();
}

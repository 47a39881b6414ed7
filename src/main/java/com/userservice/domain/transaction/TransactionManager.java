package com.userservice.domain.transaction;

import java.util.function.Supplier;

/**
 * Runs units of work against the primary store.
 *
 * <p>Transactions are bound to the calling thread and never shared. Nesting is
 * not supported: calling {@link #doInTx} or {@link #begin()} from inside an
 * open unit of work is a usage error with undefined behavior.</p>
 */
public interface TransactionManager {

    /**
     * Executes {@code work} in a new transaction. Commits if it returns,
     * rolls back if it throws and rethrows the original exception. A failing
     * rollback is logged and never replaces the original exception.
     *
     * <p>Store failures ({@code DataAccessException}, {@code TransactionException})
     * surface as {@code ServiceException} with {@code PERSISTENCE_FAILED}.</p>
     */
    <T> T doInTx(Supplier<T> work);

    /**
     * Opens a transaction the caller terminates explicitly.
     * Use with try-with-resources so {@link TransactionHandle#close()} rolls back
     * whatever was not committed.
     */
    TransactionHandle begin();
}

package com.userservice.infrastructure.persistence;

import com.userservice.domain.exception.ErrorCode;
import com.userservice.domain.exception.ServiceException;
import com.userservice.domain.transaction.TransactionHandle;
import com.userservice.domain.transaction.TransactionManager;
import jakarta.persistence.PersistenceException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.DefaultTransactionDefinition;

import java.util.function.Supplier;

/**
 * {@link TransactionManager} on top of Spring's {@link PlatformTransactionManager}.
 *
 * Spring's TransactionTemplate lets a failing rollback replace the application
 * exception, so commit and rollback are driven by hand here: the original failure
 * always wins and rollback problems are only logged.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SpringTransactionManager implements TransactionManager {

    private final PlatformTransactionManager transactionManager;

    @Override
    public <T> T doInTx(Supplier<T> work) {
        try (SpringTransactionHandle tx = open()) {
            T result;
            try {
                result = work.get();
            } catch (RuntimeException e) {
                tx.rollback();
                throw translate(e);
            } catch (Error e) {
                tx.rollback();
                throw e;
            }
            tx.commit();
            return result;
        }
    }

    @Override
    public TransactionHandle begin() {
        return open();
    }

    private SpringTransactionHandle open() {
        try {
            return new SpringTransactionHandle(transactionManager.getTransaction(new DefaultTransactionDefinition()));
        } catch (TransactionException e) {
            throw new ServiceException(ErrorCode.PERSISTENCE_FAILED, "Failed to begin transaction", e);
        }
    }

    static RuntimeException translate(RuntimeException e) {
        if (e instanceof DataAccessException || e instanceof TransactionException || e instanceof PersistenceException) {
            return new ServiceException(ErrorCode.PERSISTENCE_FAILED, "Transaction failed: " + e.getMessage(), e);
        }
        return e;
    }

    private final class SpringTransactionHandle implements TransactionHandle {

        private final TransactionStatus status;
        private boolean completed;

        private SpringTransactionHandle(TransactionStatus status) {
            this.status = status;
        }

        @Override
        public void commit() {
            if (completed) {
                throw new IllegalStateException("Transaction already completed");
            }
            completed = true;
            try {
                transactionManager.commit(status);
            } catch (RuntimeException e) {
                throw translate(e);
            }
        }

        /**
         * Never throws; a rollback failure must not mask the error that caused it.
         */
        @Override
        public void rollback() {
            if (completed) {
                return;
            }
            completed = true;
            try {
                transactionManager.rollback(status);
            } catch (RuntimeException e) {
                log.warn("failed to rollback transaction: {}", e.getMessage(), e);
            }
        }

        @Override
        public boolean isCompleted() {
            return completed;
        }

        @Override
        public void close() {
            rollback();
        }
    }
}

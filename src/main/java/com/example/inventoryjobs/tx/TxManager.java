package com.example.inventoryjobs.tx;

import com.example.inventoryjobs.exception.TransactionBeginException;
import com.example.inventoryjobs.exception.TransactionCommitException;
import com.example.inventoryjobs.exception.TransactionRollbackException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcOperations;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Optional;

/**
 * Transaction boundary shared by nested units of work.
 * <p>
 * The outermost {@code withTransaction} on a thread opens a JDBC transaction and binds it to
 * the thread. Any {@code withTransaction} reached while it is bound runs inside it, so nested
 * business operations commit or roll back together. Stores call
 * {@link #getTransactionOrDefault(JdbcOperations)} to join the ambient transaction when one
 * exists.
 * <p>
 * Outcome of the outermost call:
 * - normal return: commit, a commit failure surfaces as {@link TransactionCommitException}
 * - exception: rollback, the same exception instance is rethrown
 * - {@link Error}: rollback, the error is rethrown
 * <p>
 * There is no retry at this level.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TxManager {

    private final DataSource dataSource;

    private final ThreadLocal<AmbientTransaction> current = new ThreadLocal<>();

    public <T> T withTransaction(TransactionalWork<T> work) throws Exception {
        var ambient = current.get();
        if (ambient != null) {
            return work.execute(ambient);
        }

        var tx = begin();
        current.set(tx);
        try {
            T result;
            try {
                result = work.execute(tx);
            } catch (Exception e) {
                throw rollbackAfter(tx, e);
            } catch (Error e) {
                rollbackAfterError(tx, e);
                throw e;
            }
            commit(tx);
            return result;
        } finally {
            current.remove();
            release(tx);
        }
    }

    public void runInTransaction(TransactionalRunnable work) throws Exception {
        withTransaction(tx -> {
            work.run(tx);
            return null;
        });
    }

    /**
     * The transaction bound to the current thread, if any
     */
    public Optional<AmbientTransaction> currentTransaction() {
        return Optional.ofNullable(current.get());
    }

    public boolean isTransactionActive() {
        return current.get() != null;
    }

    /**
     * JDBC operations of the ambient transaction, or {@code fallback} outside one
     */
    public JdbcOperations getTransactionOrDefault(JdbcOperations fallback) {
        var ambient = current.get();
        return ambient != null ? ambient.getJdbc() : fallback;
    }

    private AmbientTransaction begin() {
        if (Thread.currentThread().isInterrupted()) {
            throw new TransactionBeginException("thread interrupted", null);
        }

        Connection connection = null;
        try {
            connection = dataSource.getConnection();
            connection.setAutoCommit(false);
            var tx = new AmbientTransaction(connection);
            log.trace("Began transaction {}", tx.getId());
            return tx;
        } catch (SQLException e) {
            closeAfterFailedBegin(connection, e);
            throw new TransactionBeginException(e.getMessage(), e);
        }
    }

    private void commit(AmbientTransaction tx) {
        try {
            tx.getConnection().commit();
            log.trace("Committed transaction {}", tx.getId());
        } catch (SQLException e) {
            throw new TransactionCommitException(e);
        }
    }

    private Exception rollbackAfter(AmbientTransaction tx, Exception original) {
        try {
            tx.getConnection().rollback();
            log.trace("Rolled back transaction {}: {}", tx.getId(), original.getMessage());
            return original;
        } catch (SQLException rollbackFailure) {
            log.error("Rollback of transaction {} failed", tx.getId(), rollbackFailure);
            return new TransactionRollbackException(original, rollbackFailure);
        }
    }

    private void rollbackAfterError(AmbientTransaction tx, Error error) {
        try {
            tx.getConnection().rollback();
            log.warn("Rolled back transaction {} after error: {}", tx.getId(), error.toString());
        } catch (SQLException rollbackFailure) {
            error.addSuppressed(rollbackFailure);
            log.error("Rollback of transaction {} failed after error", tx.getId(), rollbackFailure);
        }
    }

    private void release(AmbientTransaction tx) {
        var connection = tx.getConnection();
        try {
            if (!connection.isClosed()) {
                connection.setAutoCommit(true);
            }
        } catch (SQLException e) {
            log.warn("Failed to restore auto-commit on connection of transaction {}: {}", tx.getId(), e.getMessage());
        } finally {
            try {
                connection.close();
            } catch (SQLException e) {
                log.warn("Failed to close connection of transaction {}: {}", tx.getId(), e.getMessage());
            }
        }
    }

    private void closeAfterFailedBegin(Connection connection, SQLException cause) {
        if (connection == null) {
            return;
        }
        try {
            connection.close();
        } catch (SQLException closeFailure) {
            cause.addSuppressed(closeFailure);
        }
    }
}

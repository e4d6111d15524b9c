package com.example.inventoryjobs.exception;

/**
 * Exception when rolling back after a failed unit of work also failed.
 * The cause is the original failure; the rollback error is attached as suppressed.
 */
public class TransactionRollbackException extends TransactionException {

    public TransactionRollbackException(Throwable original, Throwable rollbackFailure) {
        super("rollback failed after: " + original.getMessage(), original);
        addSuppressed(rollbackFailure);
    }
}

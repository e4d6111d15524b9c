package com.example.inventoryjobs.exception;

/**
 * Exception when the unit of work succeeded but its commit failed
 */
public class TransactionCommitException extends TransactionException {

    public TransactionCommitException(Throwable cause) {
        super("failed to commit transaction: " + cause.getMessage(), cause);
    }
}

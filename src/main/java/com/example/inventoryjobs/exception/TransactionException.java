package com.example.inventoryjobs.exception;

/**
 * Base type for failures of the transaction boundary itself.
 * Exceptions thrown by the unit of work are never wrapped in this type.
 */
public abstract class TransactionException extends RuntimeException {

    protected TransactionException(String message, Throwable cause) {
        super(message, cause);
    }
}

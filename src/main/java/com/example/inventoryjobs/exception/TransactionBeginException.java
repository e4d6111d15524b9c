package com.example.inventoryjobs.exception;

/**
 * Exception when a transaction could not be started
 */
public class TransactionBeginException extends TransactionException {

    public TransactionBeginException(String message, Throwable cause) {
        super("failed to begin transaction: " + message, cause);
    }
}

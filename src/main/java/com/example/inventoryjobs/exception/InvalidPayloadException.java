package com.example.inventoryjobs.exception;

import lombok.Getter;

/**
 * Exception for task payloads that cannot be decoded
 */
@Getter
public class InvalidPayloadException extends RuntimeException {

    private final String taskType;

    public InvalidPayloadException(String taskType, String message) {
        super(String.format("Invalid %s payload: %s", taskType, message));
        this.taskType = taskType;
    }

    public InvalidPayloadException(String taskType, Exception cause) {
        super(String.format("Invalid %s payload: %s", taskType, cause.getMessage()), cause);
        this.taskType = taskType;
    }
}
